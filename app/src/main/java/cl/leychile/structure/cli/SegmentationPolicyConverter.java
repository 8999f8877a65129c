package cl.leychile.structure.cli;

import cl.leychile.structure.segment.SegmentationPolicy;
import picocli.CommandLine;

public class SegmentationPolicyConverter implements CommandLine.ITypeConverter<SegmentationPolicy> {
    @Override
    public SegmentationPolicy convert(String value) {
        return SegmentationPolicy.from(value);
    }
}

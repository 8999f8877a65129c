package cl.leychile.structure.cli;

import cl.leychile.structure.config.LogFormat;
import cl.leychile.structure.segment.SegmentationPolicy;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "norm-structure", mixinStandardHelpOptions = true,
        description = "Extracts the structure, metadata and relationships of Chilean legal texts")
public class CliArguments {

    @CommandLine.Parameters(arity = "1..*", paramLabel = "FILE", description = "Plain or markdown text files to parse")
    private List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = "--segmentation", converter = SegmentationPolicyConverter.class,
            description = "Article segmentation: structured or single-paragraph", paramLabel = "POLICY")
    private SegmentationPolicy segmentationPolicy;

    @CommandLine.Option(names = "--threads", description = "Number of worker threads", paramLabel = "COUNT")
    private Integer workerThreads;

    @CommandLine.Option(names = "--source", description = "Source label for documents that declare none", paramLabel = "LABEL")
    private String source;

    @CommandLine.Option(names = "--norm-type", description = "Norm type assumed when the text states none", paramLabel = "TYPE")
    private String normType;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public List<Path> inputs() {
        return inputs;
    }

    public SegmentationPolicy segmentationPolicy() {
        return segmentationPolicy;
    }

    public Integer workerThreads() {
        return workerThreads;
    }

    public String source() {
        return source;
    }

    public String normType() {
        return normType;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}

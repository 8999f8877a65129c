package cl.leychile.structure.segment;

import java.util.Locale;

/**
 * How article text is cut into content items.
 */
public enum SegmentationPolicy {
    STRUCTURED,
    SINGLE_PARAGRAPH;

    public static SegmentationPolicy from(String value) {
        if (value == null || value.isBlank()) {
            return STRUCTURED;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT).replace('_', '-')) {
            case "structured" -> STRUCTURED;
            case "single-paragraph", "single" -> SINGLE_PARAGRAPH;
            default -> throw new IllegalArgumentException("Unsupported segmentation policy: " + value);
        };
    }
}

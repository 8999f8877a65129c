package cl.leychile.structure.config;

import cl.leychile.structure.segment.SegmentationPolicy;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 */
public record EngineConfig(
        SegmentationPolicy segmentationPolicy,
        LogFormat logFormat,
        int workerThreads,
        String defaultSource,
        String defaultNormType,
        List<Path> inputs
) {

    public static final String DEFAULT_SOURCE = "Texto manual";
    public static final String DEFAULT_NORM_TYPE = "Ley";
    public static final int DEFAULT_WORKER_THREADS = 4;

    public EngineConfig {
        Objects.requireNonNull(segmentationPolicy, "segmentationPolicy");
        Objects.requireNonNull(logFormat, "logFormat");
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
        defaultSource = requireNonBlank(defaultSource, "defaultSource");
        defaultNormType = requireNonBlank(defaultNormType, "defaultNormType");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
    }

    public static EngineConfig defaults() {
        return new EngineConfig(SegmentationPolicy.STRUCTURED, LogFormat.TEXT, DEFAULT_WORKER_THREADS,
                DEFAULT_SOURCE, DEFAULT_NORM_TYPE, List.of());
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}

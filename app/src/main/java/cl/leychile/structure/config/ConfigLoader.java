package cl.leychile.structure.config;

import cl.leychile.structure.cli.CliArguments;
import cl.leychile.structure.segment.SegmentationPolicy;
import java.util.Objects;
import java.util.function.Function;

/**
 * Builds an {@link EngineConfig} by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_SEGMENTATION_POLICY = "SEGMENTATION_POLICY";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_WORKER_THREADS = "WORKER_THREADS";
    static final String ENV_DEFAULT_SOURCE = "DEFAULT_SOURCE";
    static final String ENV_DEFAULT_NORM_TYPE = "DEFAULT_NORM_TYPE";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public EngineConfig load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        SegmentationPolicy policy = resolveSegmentationPolicy(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        int workerThreads = resolveWorkerThreads(arguments);
        String defaultSource = firstNonBlank(arguments.source(), ENV_DEFAULT_SOURCE, EngineConfig.DEFAULT_SOURCE);
        String defaultNormType = firstNonBlank(arguments.normType(), ENV_DEFAULT_NORM_TYPE,
                EngineConfig.DEFAULT_NORM_TYPE);
        return new EngineConfig(policy, logFormat, workerThreads, defaultSource, defaultNormType, arguments.inputs());
    }

    private SegmentationPolicy resolveSegmentationPolicy(CliArguments arguments) {
        SegmentationPolicy cliPolicy = arguments.segmentationPolicy();
        if (cliPolicy != null) {
            return cliPolicy;
        }
        return environmentReader.get(ENV_SEGMENTATION_POLICY)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> parse(ENV_SEGMENTATION_POLICY, value, SegmentationPolicy::from))
                .orElse(SegmentationPolicy.STRUCTURED);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> parse(ENV_LOG_FORMAT, value, LogFormat::from))
                .orElse(LogFormat.TEXT);
    }

    private int resolveWorkerThreads(CliArguments arguments) {
        Integer threads = arguments.workerThreads();
        if (threads != null) {
            if (threads < 1) {
                throw new IllegalArgumentException("--threads must be at least 1");
            }
            return threads;
        }
        return environmentReader.get(ENV_WORKER_THREADS)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parseWorkerThreads)
                .orElse(EngineConfig.DEFAULT_WORKER_THREADS);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    private static int parseWorkerThreads(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_WORKER_THREADS + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_WORKER_THREADS + " must be an integer", ex);
        }
    }

    private static <T> T parse(String key, String raw, Function<String, T> parser) {
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(key + ": " + ex.getMessage(), ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}

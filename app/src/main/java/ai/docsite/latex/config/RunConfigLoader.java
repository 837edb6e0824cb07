package ai.docsite.latex.config;

import ai.docsite.latex.cli.CliArguments;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@link RunConfig} from CLI arguments, falling back to environment variables and defaults.
 */
public class RunConfigLoader {

    static final String ENV_WORKERS = "MD2LATEX_WORKERS";
    static final String ENV_LOG_FORMAT = "MD2LATEX_LOG_FORMAT";
    static final String ENV_TRANSFORMS = "MD2LATEX_TRANSFORMS";

    private static final int MAX_DEFAULT_WORKERS = 4;

    private final EnvironmentReader environmentReader;

    public RunConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public RunConfig load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        List<Path> inputs = arguments.inputs();
        if (inputs.isEmpty()) {
            throw new ConfigException("inputs", "at least one Markdown file must be given");
        }
        requireDistinctChapterNames(inputs);
        Path outputDir = arguments.outputDir() == null ? Path.of(".") : arguments.outputDir();
        return new RunConfig(inputs, outputDir, resolveOverrides(arguments), resolveTransforms(arguments),
                resolveWorkers(arguments), resolveLogFormat(arguments));
    }

    // each chapter becomes <name>.tex in one directory, compared case-insensitively for case-insensitive filesystems
    private static void requireDistinctChapterNames(List<Path> inputs) {
        Map<String, Path> seen = new LinkedHashMap<>();
        for (Path input : inputs) {
            Path previous = seen.putIfAbsent(RunConfig.chapterName(input).toLowerCase(Locale.ROOT), input);
            if (previous != null) {
                throw new ConfigException("inputs", "'" + previous + "' and '" + input
                        + "' would both be written as " + RunConfig.chapterName(input) + ".tex");
            }
        }
    }

    private Map<String, Object> resolveOverrides(CliArguments arguments) {
        Map<String, Object> overrides = new LinkedHashMap<>(ConfigOverrides.fromDottedPairs(arguments.overrides()));
        if (arguments.strict()) {
            ConfigOverrides.put(overrides, "parsing.strict", true);
        }
        if (arguments.stripFrontMatter()) {
            ConfigOverrides.put(overrides, "parsing.strip_front_matter", true);
        }
        return overrides;
    }

    private List<String> resolveTransforms(CliArguments arguments) {
        if (!arguments.transforms().isEmpty()) {
            return arguments.transforms();
        }
        return environmentReader.getNonBlank(ENV_TRANSFORMS)
                .map(value -> Arrays.stream(value.split(","))
                        .map(String::trim)
                        .filter(name -> !name.isEmpty())
                        .toList())
                .orElse(List.of());
    }

    private int resolveWorkers(CliArguments arguments) {
        if (arguments.workers() != null) {
            return requirePositive(arguments.workers(), "--workers");
        }
        return environmentReader.getNonBlank(ENV_WORKERS)
                .map(value -> parsePositiveInteger(value, ENV_WORKERS))
                .orElse(Math.min(MAX_DEFAULT_WORKERS, Runtime.getRuntime().availableProcessors()));
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        if (arguments.logFormat() != null) {
            return arguments.logFormat();
        }
        return environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(value -> {
                    try {
                        return LogFormat.from(value);
                    } catch (IllegalArgumentException ex) {
                        throw new ConfigException(ENV_LOG_FORMAT, ex.getMessage(), ex);
                    }
                })
                .orElse(LogFormat.TEXT);
    }

    private static int parsePositiveInteger(String value, String source) {
        try {
            return requirePositive(Integer.parseInt(value), source);
        } catch (NumberFormatException ex) {
            throw new ConfigException(source, "expected a positive integer but was '" + value + "'", ex);
        }
    }

    private static int requirePositive(int value, String source) {
        if (value < 1) {
            throw new ConfigException(source, "must be at least 1 but was " + value);
        }
        return value;
    }
}

package ai.docsite.latex.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for one command-line run: which notes to convert, where to write them and how.
 */
public record RunConfig(
        List<Path> inputs,
        Path outputDir,
        Map<String, Object> globalOverrides,
        List<String> transforms,
        int workers,
        LogFormat logFormat
) {

    public RunConfig {
        inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
        Objects.requireNonNull(outputDir, "outputDir");
        globalOverrides = Objects.requireNonNull(globalOverrides, "globalOverrides");
        transforms = List.copyOf(Objects.requireNonNull(transforms, "transforms"));
        Objects.requireNonNull(logFormat, "logFormat");
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1");
        }
    }

    /**
     * Chapter name for an input note: its file name without a trailing {@code .md}, matched case-insensitively.
     */
    public static String chapterName(Path input) {
        String fileName = input.getFileName().toString();
        return fileName.toLowerCase(Locale.ROOT).endsWith(".md")
                ? fileName.substring(0, fileName.length() - 3)
                : fileName;
    }
}

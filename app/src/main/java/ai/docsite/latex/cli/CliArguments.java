package ai.docsite.latex.cli;

import ai.docsite.latex.config.LogFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "md2latex", mixinStandardHelpOptions = true,
        description = "Converts Markdown notes into LaTeX fragments, one .tex file per note")
public class CliArguments {

    @CommandLine.Parameters(paramLabel = "FILE", arity = "0..*", description = "Markdown notes to convert")
    private List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = {"-o", "--output-dir"}, paramLabel = "DIR",
            description = "Directory for the generated .tex files (default: current directory)")
    private Path outputDir;

    @CommandLine.Option(names = "--set", paramLabel = "KEY=VALUE",
            description = "Global rule override such as headings.anchor_level=2 (repeatable)")
    private List<String> overrides = new ArrayList<>();

    @CommandLine.Option(names = "--transform", paramLabel = "NAME",
            description = "Named document transform to apply, in order (repeatable)")
    private List<String> transforms = new ArrayList<>();

    @CommandLine.Option(names = "--strict", description = "Fail on malformed tables and duplicate footnotes")
    private boolean strict;

    @CommandLine.Option(names = "--strip-front-matter", description = "Drop a leading front matter block")
    private boolean stripFrontMatter;

    @CommandLine.Option(names = "--workers", paramLabel = "COUNT", description = "Maximum number of notes converted concurrently")
    private Integer workers;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public List<Path> inputs() {
        return inputs == null ? List.of() : List.copyOf(inputs);
    }

    public Path outputDir() {
        return outputDir;
    }

    public List<String> overrides() {
        return overrides == null ? List.of() : List.copyOf(overrides);
    }

    public List<String> transforms() {
        return transforms == null ? List.of() : List.copyOf(transforms);
    }

    public boolean strict() {
        return strict;
    }

    public boolean stripFrontMatter() {
        return stripFrontMatter;
    }

    public Integer workers() {
        return workers;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}

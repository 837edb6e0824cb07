package ai.docsite.latex.cli;

import ai.docsite.latex.config.ConfigException;
import ai.docsite.latex.config.RunConfig;
import ai.docsite.latex.config.RunConfigLoader;
import ai.docsite.latex.convert.BatchOutcome;
import ai.docsite.latex.convert.Chapter;
import ai.docsite.latex.convert.ChapterBatchConverter;
import ai.docsite.latex.convert.ChapterResult;
import ai.docsite.latex.convert.MarkdownLatexConverter;
import ai.docsite.latex.generate.ImageLocator;
import ai.docsite.latex.logging.LoggingConfigurator;
import ai.docsite.latex.transform.StandardTransforms;
import ai.docsite.latex.transform.TransformRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and batch converter.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    private final RunConfigLoader configLoader;
    private final TransformRegistry registry;

    public CliApplication() {
        this(new RunConfigLoader(key -> Optional.ofNullable(System.getenv(key))), new TransformRegistry());
    }

    CliApplication(RunConfigLoader configLoader, TransformRegistry registry) {
        this.configLoader = configLoader;
        this.registry = registry;
        StandardTransforms.registerAll(registry);
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        RunConfig config;
        try {
            config = configLoader.load(cliArguments);
        } catch (ConfigException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Converting {} note(s) into {} with {} worker(s), transforms={}",
                config.inputs().size(), config.outputDir(), config.workers(), config.transforms());

        List<Chapter> chapters = new ArrayList<>();
        int unreadable = 0;
        for (Path input : config.inputs()) {
            try {
                chapters.add(new Chapter(RunConfig.chapterName(input), Files.readString(input, StandardCharsets.UTF_8)));
            } catch (IOException ex) {
                LOGGER.error("Cannot read {}: {}", input, ex.getMessage(), ex);
                unreadable++;
            }
        }

        MarkdownLatexConverter converter = new MarkdownLatexConverter(registry, ImageLocator.filesystem());
        BatchOutcome outcome;
        try {
            outcome = new ChapterBatchConverter(converter, config.workers())
                    .convertAll(chapters, config.globalOverrides(), config.transforms());
        } catch (ConfigException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        int unwritten = 0;
        for (ChapterResult result : outcome.converted()) {
            Path target = config.outputDir().resolve(result.name() + ".tex");
            try {
                Files.createDirectories(config.outputDir());
                Files.writeString(target, result.result().latex(), StandardCharsets.UTF_8);
                LOGGER.info("Wrote {} ({} diagnostic(s))", target, result.result().diagnostics().size());
            } catch (IOException ex) {
                LOGGER.error("Cannot write {}: {}", target, ex.getMessage(), ex);
                unwritten++;
            }
        }
        if (!outcome.allSucceeded()) {
            LOGGER.warn("Conversion failed for notes: {}", String.join(", ", outcome.failedChapters()));
        }
        return outcome.allSucceeded() && unreadable == 0 && unwritten == 0 ? EXIT_OK : EXIT_FAILED;
    }
}

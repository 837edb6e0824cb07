package ai.docsite.latex.convert;

import ai.docsite.latex.ast.Document;
import ai.docsite.latex.config.ConversionConfig;
import ai.docsite.latex.diagnostics.Diagnostic;
import ai.docsite.latex.diagnostics.Diagnostics;
import ai.docsite.latex.generate.ImageLocator;
import ai.docsite.latex.generate.LatexGenerator;
import ai.docsite.latex.parse.MarkdownBlockParser;
import ai.docsite.latex.transform.TransformPipeline;
import ai.docsite.latex.transform.TransformRegistry;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for converting one Markdown note: parse, apply the requested transforms, check references and render.
 *
 * <p>Every call builds its own document tree; nothing is shared between calls apart from the transform registry,
 * so one instance can serve concurrent conversions.
 */
public class MarkdownLatexConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarkdownLatexConverter.class);

    private final TransformRegistry registry;
    private final ImageLocator imageLocator;

    public MarkdownLatexConverter() {
        this(TransformRegistry.shared(), ImageLocator.filesystem());
    }

    public MarkdownLatexConverter(TransformRegistry registry, ImageLocator imageLocator) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.imageLocator = Objects.requireNonNull(imageLocator, "imageLocator");
    }

    public ConversionResult convert(String text, ConversionConfig config) {
        return convert(text, config, List.of());
    }

    /**
     * Converts {@code text}. Transform names are validated before parsing starts; any fatal error propagates as a
     * {@link ai.docsite.latex.diagnostics.ConversionException} and no output is produced.
     */
    public ConversionResult convert(String text, ConversionConfig config, List<String> transformNames) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(config, "config");
        TransformPipeline pipeline = registry.resolve(transformNames);
        Diagnostics diagnostics = new Diagnostics();
        Document document = MarkdownBlockParser.parse(text, config, diagnostics);
        Document transformed = pipeline.apply(document);
        String latex = new LatexGenerator(config, imageLocator).generate(transformed, diagnostics);
        List<Diagnostic> recorded = diagnostics.snapshot();
        for (Diagnostic diagnostic : recorded) {
            LOGGER.warn("{}", diagnostic);
        }
        return new ConversionResult(latex, recorded);
    }

    /**
     * Parses {@code text} without transforms or rendering; diagnostics raised while parsing are discarded.
     */
    public Document parse(String text, ConversionConfig config) {
        return MarkdownBlockParser.parse(Objects.requireNonNull(text, "text"), config, new Diagnostics());
    }

    /**
     * Fails with a {@link ai.docsite.latex.config.ConfigException} when any name is not registered.
     */
    public void checkTransforms(List<String> transformNames) {
        registry.resolve(transformNames);
    }
}

package ai.docsite.latex.convert;

import ai.docsite.latex.config.ConversionConfig;
import ai.docsite.latex.config.ConversionConfigResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Converts independent chapters on a bounded worker pool. A failing chapter is reported in the outcome and never
 * affects its siblings.
 */
public class ChapterBatchConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChapterBatchConverter.class);
    static final String MDC_CHAPTER = "chapter";

    private final MarkdownLatexConverter converter;
    private final ConversionConfigResolver resolver;
    private final int workers;

    public ChapterBatchConverter(MarkdownLatexConverter converter, int workers) {
        this(converter, new ConversionConfigResolver(), workers);
    }

    public ChapterBatchConverter(MarkdownLatexConverter converter, ConversionConfigResolver resolver, int workers) {
        this.converter = Objects.requireNonNull(converter, "converter");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1");
        }
        this.workers = workers;
    }

    public BatchOutcome convertAll(List<Chapter> chapters, Map<String, ?> globalOverrides,
                                   List<String> transformNames) {
        if (chapters == null || chapters.isEmpty()) {
            return new BatchOutcome(List.of(), List.of());
        }
        List<String> transforms = transformNames == null ? List.of() : List.copyOf(transformNames);
        converter.checkTransforms(transforms);
        Map<String, ?> global = globalOverrides == null ? Map.of() : globalOverrides;

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, chapters.size()));
        try {
            List<Future<ChapterResult>> futures = new ArrayList<>(chapters.size());
            for (Chapter chapter : chapters) {
                futures.add(executor.submit(() -> convertChapter(chapter, global, transforms)));
            }
            List<ChapterResult> converted = new ArrayList<>();
            List<ChapterFailure> failed = new ArrayList<>();
            for (int i = 0; i < chapters.size(); i++) {
                String name = chapters.get(i).name();
                try {
                    converted.add(futures.get(i).get());
                } catch (ExecutionException ex) {
                    RuntimeException cause = ex.getCause() instanceof RuntimeException runtime
                            ? runtime
                            : new IllegalStateException(ex.getCause());
                    LOGGER.error("Conversion failed for {}: {}", name, cause.getMessage(), cause);
                    failed.add(new ChapterFailure(name, cause));
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while converting " + name, ex);
                }
            }
            LOGGER.info("Converted {} of {} chapters", converted.size(), chapters.size());
            return new BatchOutcome(converted, failed);
        } finally {
            executor.shutdownNow();
        }
    }

    private ChapterResult convertChapter(Chapter chapter, Map<String, ?> global, List<String> transforms) {
        MDC.put(MDC_CHAPTER, chapter.name());
        try {
            ConversionConfig config = resolver.resolve(global, chapter.overrides());
            ConversionResult result = converter.convert(chapter.text(), config, transforms);
            LOGGER.info("Converted {} with {} diagnostic(s)", chapter.name(), result.diagnostics().size());
            return new ChapterResult(chapter.name(), result);
        } finally {
            MDC.remove(MDC_CHAPTER);
        }
    }
}

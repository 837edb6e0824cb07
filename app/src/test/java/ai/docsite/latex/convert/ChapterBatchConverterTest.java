package ai.docsite.latex.convert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.docsite.latex.config.ConfigException;
import ai.docsite.latex.config.ConfigOverrides;
import ai.docsite.latex.generate.UnresolvedReferenceException;
import ai.docsite.latex.transform.TransformRegistry;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class ChapterBatchConverterTest {

    private final TransformRegistry registry = new TransformRegistry();
    private final MarkdownLatexConverter converter = new MarkdownLatexConverter(registry, (path, baseDir) -> true);

    @Test
    void keepsInputOrderAndIsolatesFailures() {
        List<Chapter> chapters = List.of(
                new Chapter("one", "# One"),
                new Chapter("broken", "Claim[^missing]."),
                new Chapter("two", "# Two"),
                new Chapter("three", "# Three"));

        BatchOutcome outcome = new ChapterBatchConverter(converter, 3).convertAll(chapters, Map.of(), List.of());

        assertThat(outcome.allSucceeded()).isFalse();
        assertThat(outcome.converted()).extracting(ChapterResult::name).containsExactly("one", "two", "three");
        assertThat(outcome.converted()).extracting(result -> result.result().latex())
                .containsExactly("\\section{One}", "\\section{Two}", "\\section{Three}");
        assertThat(outcome.failedChapters()).containsExactly("broken");
        assertThat(outcome.failed().get(0).cause()).isInstanceOf(UnresolvedReferenceException.class);
        assertThat(outcome.failed().get(0).message()).contains("missing");
    }

    @Test
    void chapterOverridesWinOverGlobalOnes() {
        Map<String, Object> global = ConfigOverrides.fromDottedPairs(List.of(
                "labels.auto_label_headings=true", "labels.label_prefix=book"));
        List<Chapter> chapters = List.of(
                new Chapter("a", "# Intro"),
                new Chapter("b", "# Intro", ConfigOverrides.fromDottedPairs(List.of("labels.label_prefix=ch2"))));

        BatchOutcome outcome = new ChapterBatchConverter(converter, 2).convertAll(chapters, global, List.of());

        assertThat(outcome.converted()).extracting(result -> result.result().latex()).containsExactly(
                "\\section{Intro}\n\\label{book-intro}",
                "\\section{Intro}\n\\label{ch2-intro}");
    }

    @Test
    void invalidChapterConfigurationOnlyFailsThatChapter() {
        List<Chapter> chapters = List.of(
                new Chapter("good", "text"),
                new Chapter("bad", "text", Map.of("headings", Map.of("anchor_level", 9))));

        BatchOutcome outcome = new ChapterBatchConverter(converter, 1).convertAll(chapters, Map.of(), List.of());

        assertThat(outcome.converted()).extracting(ChapterResult::name).containsExactly("good");
        assertThat(outcome.failed().get(0).cause()).isInstanceOf(ConfigException.class);
    }

    @Test
    void unknownTransformAbortsBeforeAnyChapterRuns() {
        Throwable thrown = catchThrowable(() -> new ChapterBatchConverter(converter, 2)
                .convertAll(List.of(new Chapter("a", "text")), Map.of(), List.of("missing")));

        assertThat(thrown).isInstanceOf(ConfigException.class).hasMessageContaining("missing");
    }

    @Test
    void tagsWorkerThreadsWithChapterName() {
        ConcurrentLinkedQueue<String> seen = new ConcurrentLinkedQueue<>();
        registry.register("record-chapter", document -> {
            seen.add(MDC.get(ChapterBatchConverter.MDC_CHAPTER));
            return document;
        });

        new ChapterBatchConverter(converter, 2).convertAll(
                List.of(new Chapter("alpha", "a"), new Chapter("beta", "b")), Map.of(), List.of("record-chapter"));

        assertThat(seen).containsExactlyInAnyOrder("alpha", "beta");
    }

    @Test
    void emptyBatchSucceeds() {
        BatchOutcome outcome = new ChapterBatchConverter(converter, 4).convertAll(List.of(), Map.of(), List.of());

        assertThat(outcome.allSucceeded()).isTrue();
        assertThat(outcome.converted()).isEmpty();
    }

    @Test
    void rejectsNonPositiveWorkerCount() {
        assertThat(catchThrowable(() -> new ChapterBatchConverter(converter, 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

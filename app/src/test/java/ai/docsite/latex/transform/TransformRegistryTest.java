package ai.docsite.latex.transform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.docsite.latex.ast.Document;
import ai.docsite.latex.ast.Paragraph;
import ai.docsite.latex.ast.Text;
import ai.docsite.latex.config.ConfigException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TransformRegistryTest {

    private final TransformRegistry registry = new TransformRegistry();

    @Test
    void resolvesTransformsInRequestedOrderKeepingRepeats() {
        List<String> calls = new ArrayList<>();
        registry.register("first", document -> {
            calls.add("first");
            return document;
        });
        registry.register("second", document -> {
            calls.add("second");
            return document;
        });

        TransformPipeline pipeline = registry.resolve(List.of("second", "first", "second"));
        pipeline.apply(new Document(List.of(), Map.of()));

        assertThat(pipeline.names()).containsExactly("second", "first", "second");
        assertThat(calls).containsExactly("second", "first", "second");
    }

    @Test
    void rejectsDuplicateAndBlankNames() {
        registry.register("noop", document -> document);

        assertThat(catchThrowable(() -> registry.register("noop", document -> document)))
                .isInstanceOf(ConfigException.class);
        assertThat(catchThrowable(() -> registry.register(" ", document -> document)))
                .isInstanceOf(ConfigException.class);
        assertThat(registry.names()).containsExactly("noop");
        assertThat(registry.contains("noop")).isTrue();
    }

    @Test
    void unknownNamesFailBeforeAnythingRuns() {
        List<String> calls = new ArrayList<>();
        registry.register("known", document -> {
            calls.add("known");
            return document;
        });

        Throwable thrown = catchThrowable(() -> registry.resolve(List.of("known", "missing")));

        assertThat(thrown).isInstanceOf(ConfigException.class).hasMessageContaining("missing");
        assertThat(calls).isEmpty();
    }

    @Test
    void emptySelectionIsIdentity() {
        Document document = new Document(List.of(new Paragraph(List.of(new Text("x")))), Map.of());

        assertThat(registry.resolve(List.of()).apply(document)).isSameAs(document);
    }

    @Test
    void failingTransformAbortsPipeline() {
        registry.register("boom", document -> {
            throw new IllegalStateException("kaput");
        });
        registry.register("null", document -> null);

        Throwable failure = catchThrowable(() -> registry.resolve(List.of("boom")).apply(new Document(List.of(), Map.of())));
        Throwable missing = catchThrowable(() -> registry.resolve(List.of("null")).apply(new Document(List.of(), Map.of())));

        assertThat(failure).isInstanceOf(TransformException.class)
                .hasMessageContaining("boom")
                .hasMessageContaining("kaput")
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(missing).isInstanceOf(TransformException.class).hasMessageContaining("null");
    }
}

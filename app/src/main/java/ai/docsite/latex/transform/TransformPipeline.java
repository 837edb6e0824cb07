package ai.docsite.latex.transform;

import ai.docsite.latex.ast.Document;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered list of transforms resolved from a {@link TransformRegistry}.
 */
public final class TransformPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransformPipeline.class);

    record Step(String name, DocumentTransform transform) {
    }

    private final List<Step> steps;

    TransformPipeline(List<Step> steps) {
        this.steps = List.copyOf(steps);
    }

    public static TransformPipeline empty() {
        return new TransformPipeline(List.of());
    }

    public List<String> names() {
        return steps.stream().map(Step::name).toList();
    }

    /**
     * Runs every transform in order. The first failure aborts the pipeline.
     */
    public Document apply(Document document) {
        Document current = Objects.requireNonNull(document, "document");
        for (Step step : steps) {
            Document next;
            try {
                next = step.transform().apply(current);
            } catch (RuntimeException ex) {
                throw new TransformException(step.name(), "transform failed: " + ex.getMessage(), ex);
            }
            if (next == null) {
                throw new TransformException(step.name(), "transform returned no document");
            }
            LOGGER.debug("Applied transform {}", step.name());
            current = next;
        }
        return current;
    }
}

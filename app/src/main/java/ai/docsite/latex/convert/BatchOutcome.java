package ai.docsite.latex.convert;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate of a batch run; both lists keep the input order of the chapters.
 */
public record BatchOutcome(List<ChapterResult> converted, List<ChapterFailure> failed) {

    public BatchOutcome {
        converted = List.copyOf(Objects.requireNonNull(converted, "converted"));
        failed = List.copyOf(Objects.requireNonNull(failed, "failed"));
    }

    public boolean allSucceeded() {
        return failed.isEmpty();
    }

    public List<String> failedChapters() {
        return failed.stream().map(ChapterFailure::name).toList();
    }
}

package ai.docsite.latex.convert;

import java.util.Objects;

/**
 * A chapter whose conversion aborted; {@code cause} is the exception that stopped it.
 */
public record ChapterFailure(String name, RuntimeException cause) {

    public ChapterFailure {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(cause, "cause");
    }

    public String message() {
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}

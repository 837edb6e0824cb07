package ai.docsite.latex.ast;

import java.util.Objects;

/**
 * Text wrapped in a configured symbol pair such as {@code ==highlight==}.
 */
public record CustomMarker(String symbol, String text) implements Inline {

    public CustomMarker {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(text, "text");
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitCustomMarker(this);
    }
}

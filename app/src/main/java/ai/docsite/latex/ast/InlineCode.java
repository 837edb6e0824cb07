package ai.docsite.latex.ast;

import java.util.Objects;

public record InlineCode(String literal) implements Inline {

    public InlineCode {
        Objects.requireNonNull(literal, "literal");
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitInlineCode(this);
    }
}

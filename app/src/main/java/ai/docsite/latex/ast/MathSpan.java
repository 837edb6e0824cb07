package ai.docsite.latex.ast;

import java.util.Objects;

public record MathSpan(boolean inline, String literal) implements Inline {

    public MathSpan {
        Objects.requireNonNull(literal, "literal");
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitMath(this);
    }
}

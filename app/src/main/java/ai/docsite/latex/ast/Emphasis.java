package ai.docsite.latex.ast;

import java.util.List;

public record Emphasis(boolean strong, List<Inline> children) implements Inline {

    public Emphasis {
        children = List.copyOf(children);
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitEmphasis(this);
    }
}

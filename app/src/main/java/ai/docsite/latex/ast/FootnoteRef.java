package ai.docsite.latex.ast;

import java.util.Objects;

public record FootnoteRef(String id) implements Inline {

    public FootnoteRef {
        Objects.requireNonNull(id, "id");
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitFootnoteRef(this);
    }
}

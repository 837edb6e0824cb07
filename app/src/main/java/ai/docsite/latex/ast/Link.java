package ai.docsite.latex.ast;

import java.util.List;
import java.util.Objects;

public record Link(LinkTarget target, List<Inline> children) implements Inline {

    public Link {
        Objects.requireNonNull(target, "target");
        children = List.copyOf(children);
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitLink(this);
    }
}

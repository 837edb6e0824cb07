package ai.docsite.latex.ast;

import java.util.List;

public record ListBlock(boolean ordered, List<ListItem> items) implements Block {

    public ListBlock {
        items = List.copyOf(items);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitList(this);
    }
}

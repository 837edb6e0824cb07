package ai.docsite.latex.ast;

import java.util.List;

/**
 * One list entry; its blocks may include nested lists.
 */
public record ListItem(List<Block> children) {

    public ListItem {
        children = List.copyOf(children);
    }
}

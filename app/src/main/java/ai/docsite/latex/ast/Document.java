package ai.docsite.latex.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Root of a parsed note: ordered blocks plus the footnote side-table keyed by footnote id.
 */
public record Document(List<Block> children, Map<String, FootnoteDefinition> footnotes) {

    public Document {
        children = List.copyOf(children);
        footnotes = footnotes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(footnotes));
    }

    public Document(List<Block> children) {
        this(children, Map.of());
    }

    public Optional<FootnoteDefinition> footnote(String id) {
        return Optional.ofNullable(footnotes.get(id));
    }

    public Document withChildren(List<Block> newChildren) {
        return new Document(newChildren, footnotes);
    }
}

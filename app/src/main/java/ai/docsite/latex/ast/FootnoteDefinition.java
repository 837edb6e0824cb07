package ai.docsite.latex.ast;

import java.util.List;

public record FootnoteDefinition(String id, List<Inline> body) {

    public FootnoteDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("footnote id must not be blank");
        }
        body = List.copyOf(body);
    }
}

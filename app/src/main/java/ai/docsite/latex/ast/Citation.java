package ai.docsite.latex.ast;

import java.util.List;

/**
 * One bracketed citation group; entries keep their source order.
 */
public record Citation(List<CitationEntry> entries) implements Inline {

    public Citation {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("citation must have at least one entry");
        }
        entries = List.copyOf(entries);
    }

    public boolean hasLocators() {
        return entries.stream().anyMatch(entry -> entry.locator().isPresent());
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitCitation(this);
    }
}

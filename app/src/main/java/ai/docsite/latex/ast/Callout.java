package ai.docsite.latex.ast;

import java.util.List;
import java.util.Optional;

/**
 * Admonition written as {@code > [!KIND] title}; {@code kind} is kept as written.
 */
public record Callout(String kind, Optional<List<Inline>> title, List<Block> body) implements Block {

    public Callout {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("callout kind must not be blank");
        }
        title = title == null ? Optional.empty() : title.map(List::copyOf);
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitCallout(this);
    }
}

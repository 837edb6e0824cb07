package ai.docsite.latex.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Markdown heading; {@code label} is only present when the author wrote an explicit {@code {#id}} suffix.
 */
public record Heading(int level, List<Inline> content, Optional<String> label) implements Block {

    public Heading {
        if (level < 1 || level > 6) {
            throw new IllegalArgumentException("heading level must be between 1 and 6");
        }
        content = List.copyOf(content);
        label = label == null ? Optional.empty() : label;
    }

    public Heading(int level, List<Inline> content) {
        this(level, content, Optional.empty());
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitHeading(this);
    }

    public Heading withContent(List<Inline> newContent) {
        return new Heading(level, Objects.requireNonNull(newContent, "newContent"), label);
    }
}

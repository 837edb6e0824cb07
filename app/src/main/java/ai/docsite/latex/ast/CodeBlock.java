package ai.docsite.latex.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * Fenced code block; the literal is never interpreted.
 */
public record CodeBlock(Optional<String> language, String literal) implements Block {

    public CodeBlock {
        language = language == null ? Optional.empty() : language.filter(value -> !value.isBlank());
        literal = Objects.requireNonNull(literal, "literal");
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitCodeBlock(this);
    }
}

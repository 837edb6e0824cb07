package ai.docsite.latex.ast;

import java.util.Objects;
import java.util.Optional;

public record Image(String source, String alt, Optional<String> width) implements Block {

    public Image {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("image source must not be blank");
        }
        alt = Objects.requireNonNullElse(alt, "");
        width = width == null ? Optional.empty() : width.filter(value -> !value.isBlank());
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitImage(this);
    }
}

package ai.docsite.latex.convert;

import java.util.Map;
import java.util.Objects;

/**
 * One note of a batch with its chapter-scope configuration overrides.
 */
public record Chapter(String name, String text, Map<String, Object> overrides) {

    public Chapter {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("chapter name must not be blank");
        }
        Objects.requireNonNull(text, "text");
        overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
    }

    public Chapter(String name, String text) {
        this(name, text, Map.of());
    }
}

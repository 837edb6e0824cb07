package ai.docsite.latex.ast;

import java.util.Optional;

public record CitationEntry(String key, Optional<String> locator) {

    public CitationEntry {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("citation key must not be blank");
        }
        locator = locator == null ? Optional.empty() : locator.filter(value -> !value.isBlank());
    }
}

package ai.docsite.latex.convert;

import java.util.Objects;

public record ChapterResult(String name, ConversionResult result) {

    public ChapterResult {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(result, "result");
    }
}

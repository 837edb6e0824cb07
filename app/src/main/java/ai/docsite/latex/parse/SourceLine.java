package ai.docsite.latex.parse;

import java.util.Objects;

/**
 * A line of the note together with its 1-based line number in the original input.
 */
record SourceLine(int number, String text) {

    SourceLine {
        Objects.requireNonNull(text, "text");
        if (number < 1) {
            throw new IllegalArgumentException("line numbers start at 1");
        }
    }

    SourceLine withText(String newText) {
        return new SourceLine(number, newText);
    }

    boolean isBlank() {
        return text.isBlank();
    }
}

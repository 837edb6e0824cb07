package ai.docsite.latex.parse;

import ai.docsite.latex.diagnostics.ConversionException;

/**
 * Raised for malformed block structure when strict parsing is enabled.
 */
public class MarkdownParseException extends ConversionException {

    private final int line;

    public MarkdownParseException(String construct, int line, String message) {
        super(construct, "line " + line, message);
        this.line = line;
    }

    public int line() {
        return line;
    }
}

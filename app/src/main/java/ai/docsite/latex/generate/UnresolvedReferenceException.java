package ai.docsite.latex.generate;

import ai.docsite.latex.diagnostics.ConversionException;

/**
 * Raised when a footnote reference or an internal link points at nothing, or when footnotes reference each other
 * in a cycle.
 */
public class UnresolvedReferenceException extends ConversionException {

    public UnresolvedReferenceException(String construct, String target, String message) {
        super(construct, target, message);
    }
}

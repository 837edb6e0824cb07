package ai.docsite.latex.transform;

import ai.docsite.latex.diagnostics.ConversionException;

/**
 * Raised when a registered transform fails or returns no document.
 */
public class TransformException extends ConversionException {

    public TransformException(String transformName, String message) {
        super("transform", transformName, message);
    }

    public TransformException(String transformName, String message, Throwable cause) {
        super("transform", transformName, message, cause);
    }
}

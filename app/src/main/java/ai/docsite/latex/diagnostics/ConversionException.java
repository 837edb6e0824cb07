package ai.docsite.latex.diagnostics;

import java.util.Objects;

/**
 * Runtime exception used to abort the conversion of a single document.
 *
 * <p>Carries the kind of construct that failed and an approximate location so the cause can be found in the
 * source note.
 */
public class ConversionException extends RuntimeException {

    private final String construct;
    private final String location;

    public ConversionException(String construct, String location, String message) {
        this(construct, location, message, null);
    }

    public ConversionException(String construct, String location, String message, Throwable cause) {
        super(describe(construct, location, message), cause);
        this.construct = Objects.requireNonNull(construct, "construct");
        this.location = location == null ? "" : location;
    }

    public String construct() {
        return construct;
    }

    public String location() {
        return location;
    }

    private static String describe(String construct, String location, String message) {
        if (location == null || location.isBlank()) {
            return construct + ": " + message;
        }
        return construct + " (" + location + "): " + message;
    }
}

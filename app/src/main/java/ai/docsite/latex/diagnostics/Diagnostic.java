package ai.docsite.latex.diagnostics;

import java.util.Objects;

/**
 * A cosmetic issue that degraded the output without aborting the conversion.
 */
public record Diagnostic(DiagnosticKind kind, String message, String location) {

    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        location = location == null ? "" : location;
    }

    @Override
    public String toString() {
        return location.isEmpty() ? kind + ": " + message : kind + " (" + location + "): " + message;
    }
}

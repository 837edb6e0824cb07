package ai.docsite.latex.diagnostics;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects diagnostics for one conversion call in the order they were reported.
 *
 * <p>Instances are confined to the thread running the conversion.
 */
public final class Diagnostics {

    private final List<Diagnostic> entries = new ArrayList<>();

    public void report(DiagnosticKind kind, String location, String message) {
        entries.add(new Diagnostic(kind, message, location));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<Diagnostic> snapshot() {
        return List.copyOf(entries);
    }
}

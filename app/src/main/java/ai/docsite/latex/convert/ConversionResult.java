package ai.docsite.latex.convert;

import ai.docsite.latex.diagnostics.Diagnostic;
import java.util.List;
import java.util.Objects;

/**
 * LaTeX fragment produced for one note together with the diagnostics recorded on the way.
 */
public record ConversionResult(String latex, List<Diagnostic> diagnostics) {

    public ConversionResult {
        Objects.requireNonNull(latex, "latex");
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}

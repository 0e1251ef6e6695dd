package org.pragmatica.dvrtl.parser;

import org.pragmatica.dvrtl.ast.Circuit;
import org.pragmatica.dvrtl.error.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * Result of parsing with diagnostics - either a circuit or the diagnostics explaining why there is none.
 *
 * @param circuit     The circuit, or empty if the pass failed
 * @param diagnostics Diagnostic messages (empty on success)
 * @param source      Source text the diagnostics point into
 */
public record ParseOutcome(
    Optional<Circuit> circuit,
    List<Diagnostic> diagnostics,
    String source
) {
    public ParseOutcome {
        diagnostics = List.copyOf(diagnostics);
    }

    public static ParseOutcome success(Circuit circuit, String source) {
        return new ParseOutcome(Optional.of(circuit), List.of(), source);
    }

    public static ParseOutcome failure(Diagnostic diagnostic, String source) {
        return new ParseOutcome(Optional.empty(), List.of(diagnostic), source);
    }

    public boolean isSuccess() {
        return circuit.isPresent() && diagnostics.isEmpty();
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Format all diagnostics in Rust style.
     *
     * @param filename Optional filename for display
     * @return Formatted diagnostics string
     */
    public String formatDiagnostics(String filename) {
        if (diagnostics.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        for (var diag : diagnostics) {
            sb.append(diag.format(source, filename));
            sb.append("\n");
        }
        return sb.toString();
    }

    /**
     * Format all diagnostics with default filename "input".
     */
    public String formatDiagnostics() {
        return formatDiagnostics("input");
    }
}

package org.pragmatica.dvrtl.error;

/**
 * Aborts a parse or transform pass. Carries the error that stopped it.
 */
public final class CircuitException extends RuntimeException {
    private final CircuitError error;

    public CircuitException(CircuitError error) {
        super(error.message());
        this.error = error;
    }

    public CircuitError error() {
        return error;
    }

    /**
     * Convert the error into a diagnostic for display.
     */
    public Diagnostic toDiagnostic() {
        return Diagnostic.of(error);
    }
}

package no.cantara.siren.model;

/**
 * Stable diagnostic codes. Only the parser produces {@link #E001}.
 */
public enum DiagnosticCode {
    E001(Severity.ERROR),
    W001(Severity.WARNING),
    W002(Severity.WARNING),
    W003(Severity.WARNING),
    W004(Severity.WARNING),
    W005(Severity.WARNING),
    W006(Severity.WARNING);

    private final Severity severity;

    DiagnosticCode(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }
}

package me.christianrobert.namereduce.semantic;

import me.christianrobert.namereduce.syntax.TextSpan;

import java.util.Objects;

/**
 * A semantic-analysis finding for one specific tree snapshot.
 *
 * <p>The span refers to the snapshot the diagnostic was computed against and must only be
 * mapped back onto nodes of that same snapshot.</p>
 */
public class Diagnostic {

    private final String id;
    private final TextSpan span;
    private final DiagnosticSeverity severity;
    private final String message;
    private final boolean inSource;

    public Diagnostic(String id, TextSpan span, DiagnosticSeverity severity, String message, boolean inSource) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Diagnostic id cannot be null or empty");
        }
        this.id = id;
        this.span = span;
        this.severity = severity != null ? severity : DiagnosticSeverity.ERROR;
        this.message = message != null ? message : "";
        this.inSource = inSource && span != null;
    }

    /**
     * Creates an error located in the document's source.
     */
    public static Diagnostic error(String id, TextSpan span, String message) {
        return new Diagnostic(id, span, DiagnosticSeverity.ERROR, message, true);
    }

    public String getId() {
        return id;
    }

    /**
     * Source span, or null for diagnostics without a source location.
     */
    public TextSpan getSpan() {
        return span;
    }

    public DiagnosticSeverity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    /**
     * False for diagnostics synthesized without a location in this document.
     */
    public boolean isInSource() {
        return inSource;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Diagnostic that = (Diagnostic) o;
        return inSource == that.inSource
                && id.equals(that.id)
                && Objects.equals(span, that.span)
                && severity == that.severity
                && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, span, severity, message, inSource);
    }

    @Override
    public String toString() {
        return id + " " + severity + (span != null ? " " + span : "") + ": " + message;
    }
}

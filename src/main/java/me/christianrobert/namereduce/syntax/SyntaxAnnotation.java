package me.christianrobert.namereduce.syntax;

import java.util.Objects;

/**
 * Out-of-band metadata attached to a syntax node without changing its text.
 *
 * <p>Two kinds are used by this project:
 * <ul>
 *   <li>{@link #CONVERSION_WARNING_KIND} - a non-fatal conversion warning; the data is the
 *       human-readable warning text</li>
 *   <li>{@link #SIMPLIFY_KIND} - a deferred request to rewrite the annotated subtree to its
 *       minimal form; consumed by the semantic oracle's reduction step</li>
 * </ul>
 */
public class SyntaxAnnotation {

    public static final String CONVERSION_WARNING_KIND = "conversion-warning";
    public static final String SIMPLIFY_KIND = "simplify";

    /** Marker requesting a minimal-form rewrite of the annotated subtree. */
    public static final SyntaxAnnotation SIMPLIFIER_MARKER = new SyntaxAnnotation(SIMPLIFY_KIND, null);

    private final String kind;
    private final String data;

    public SyntaxAnnotation(String kind, String data) {
        if (kind == null || kind.trim().isEmpty()) {
            throw new IllegalArgumentException("Annotation kind cannot be null or empty");
        }
        this.kind = kind;
        this.data = data;
    }

    public static SyntaxAnnotation conversionWarning(String text) {
        return new SyntaxAnnotation(CONVERSION_WARNING_KIND, text);
    }

    public String getKind() {
        return kind;
    }

    public String getData() {
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SyntaxAnnotation that = (SyntaxAnnotation) o;
        return kind.equals(that.kind) && Objects.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, data);
    }

    @Override
    public String toString() {
        return data == null ? kind : kind + ": " + data;
    }
}

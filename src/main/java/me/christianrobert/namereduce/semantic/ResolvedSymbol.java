package me.christianrobert.namereduce.semantic;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A namespace, type or member a name resolved to, identified by its fully qualified name
 * in declared casing (e.g. {@code System.Collections.Generic.List}).
 */
public class ResolvedSymbol {

    private final SymbolKind kind;
    private final String qualifiedName;

    public ResolvedSymbol(SymbolKind kind, String qualifiedName) {
        if (kind == null) {
            throw new IllegalArgumentException("Symbol kind cannot be null");
        }
        if (qualifiedName == null || qualifiedName.trim().isEmpty()) {
            throw new IllegalArgumentException("Qualified name cannot be null or empty");
        }
        this.kind = kind;
        this.qualifiedName = qualifiedName;
    }

    public SymbolKind getKind() {
        return kind;
    }

    public String getQualifiedName() {
        return qualifiedName;
    }

    public List<String> getSegments() {
        return Arrays.asList(qualifiedName.split("\\."));
    }

    /**
     * Last segment of the qualified name.
     */
    public String getName() {
        int lastDot = qualifiedName.lastIndexOf('.');
        return lastDot < 0 ? qualifiedName : qualifiedName.substring(lastDot + 1);
    }

    /**
     * Qualified name of the containing namespace or type, or null for top-level symbols.
     */
    public String getContainerName() {
        int lastDot = qualifiedName.lastIndexOf('.');
        return lastDot < 0 ? null : qualifiedName.substring(0, lastDot);
    }

    public boolean isNamespace() {
        return kind == SymbolKind.NAMESPACE;
    }

    public boolean isType() {
        return kind == SymbolKind.TYPE;
    }

    public boolean isMember() {
        return kind == SymbolKind.MEMBER;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolvedSymbol that = (ResolvedSymbol) o;
        return kind == that.kind && qualifiedName.equals(that.qualifiedName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, qualifiedName);
    }

    @Override
    public String toString() {
        return kind + " " + qualifiedName;
    }
}

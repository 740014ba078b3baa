package me.christianrobert.namereduce.grammar;

import me.christianrobert.namereduce.syntax.SyntaxNode;

import java.util.Locale;

/**
 * Target grammars a translated document can be written in.
 *
 * <p>Only properties of the language itself live here (case sensitivity, keywords, which
 * node kinds count as expressions, how imports bring names into scope). Choosing expansion
 * policies and unsafe-shape tables per grammar is done by the pipeline in
 * {@link me.christianrobert.namereduce.service.NameReductionService}.</p>
 */
public enum Grammar {

    CSHARP("C#", true, false, "CS0246"),
    VISUAL_BASIC("Visual Basic", false, true, "BC30002");

    private final String displayName;
    private final boolean caseSensitive;
    private final boolean importsExposeNamespaces;
    private final String unresolvedTypeDiagnosticId;

    Grammar(String displayName, boolean caseSensitive, boolean importsExposeNamespaces,
            String unresolvedTypeDiagnosticId) {
        this.displayName = displayName;
        this.caseSensitive = caseSensitive;
        this.importsExposeNamespaces = importsExposeNamespaces;
        this.unresolvedTypeDiagnosticId = unresolvedTypeDiagnosticId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    /**
     * Whether an import directive makes nested namespaces of the imported namespace
     * usable by their short name (Visual Basic does, C# only exposes types).
     */
    public boolean importsExposeNamespaces() {
        return importsExposeNamespaces;
    }

    /**
     * Diagnostic id the compiler reports for a type or namespace name it cannot resolve.
     */
    public String getUnresolvedTypeDiagnosticId() {
        return unresolvedTypeDiagnosticId;
    }

    /**
     * Expression nodes are never descended into when collecting simplification candidates.
     */
    public boolean isExpression(SyntaxNode node) {
        return node.getKind().isExpression();
    }

    public boolean namesEqual(String left, String right) {
        return caseSensitive ? left.equals(right) : left.equalsIgnoreCase(right);
    }

    /**
     * Normalizes a name for lookups in case-insensitive grammars.
     */
    public String normalizeName(String name) {
        return caseSensitive ? name : name.toLowerCase(Locale.ROOT);
    }

    // Keywords used when building trees for this grammar

    public String importKeyword() {
        return this == CSHARP ? "using" : "Imports";
    }

    public String newKeyword() {
        return this == CSHARP ? "new" : "New";
    }

    public String namespaceKeyword() {
        return this == CSHARP ? "namespace" : "Namespace";
    }

    public String classKeyword() {
        return this == CSHARP ? "class" : "Class";
    }

    public String returnKeyword() {
        return this == CSHARP ? "return" : "Return";
    }
}

package me.christianrobert.namereduce.semantic.index;

import me.christianrobert.namereduce.grammar.Grammar;
import me.christianrobert.namereduce.semantic.ResolvedSymbol;
import me.christianrobert.namereduce.semantic.SymbolKind;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Known namespaces, types and members of the converted project, keyed by qualified name.
 *
 * <p>This is a pure data structure with no service dependencies. Keys are normalized with
 * the grammar's case rules, so lookups in a Visual Basic index are case-insensitive while the
 * returned symbols keep their declared casing. Immutable and safe to share across documents.</p>
 *
 * <p>Built by {@link SymbolIndexBuilder}.</p>
 */
public class SymbolIndex {

    private final Grammar grammar;

    // Key: normalized qualified name, Value: symbol in declared casing
    private final Map<String, ResolvedSymbol> symbols;

    SymbolIndex(Grammar grammar, Map<String, ResolvedSymbol> symbols) {
        this.grammar = grammar;
        this.symbols = Collections.unmodifiableMap(new HashMap<>(symbols));
    }

    public static SymbolIndex empty(Grammar grammar) {
        return new SymbolIndex(grammar, Collections.emptyMap());
    }

    public Grammar getGrammar() {
        return grammar;
    }

    /**
     * Looks up a symbol by its fully qualified name.
     *
     * @return The symbol, or null if unknown
     */
    public ResolvedSymbol lookup(String qualifiedName) {
        if (qualifiedName == null) {
            return null;
        }
        return symbols.get(grammar.normalizeName(qualifiedName));
    }

    /**
     * Looks up a direct child (namespace, type or member) of a namespace or type.
     */
    public ResolvedSymbol lookupChild(ResolvedSymbol container, String name) {
        if (container == null || container.isMember()) {
            return null;
        }
        ResolvedSymbol child = lookup(container.getQualifiedName() + "." + name);
        if (child != null && child.isMember() && !container.isType()) {
            return null;
        }
        return child;
    }

    public boolean isNamespace(String qualifiedName) {
        ResolvedSymbol symbol = lookup(qualifiedName);
        return symbol != null && symbol.getKind() == SymbolKind.NAMESPACE;
    }

    public Collection<ResolvedSymbol> getSymbols() {
        return symbols.values();
    }

    public int size() {
        return symbols.size();
    }

    @Override
    public String toString() {
        return "SymbolIndex{grammar=" + grammar + ", symbols=" + symbols.size() + "}";
    }
}

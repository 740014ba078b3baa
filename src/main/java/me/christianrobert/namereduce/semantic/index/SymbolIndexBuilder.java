package me.christianrobert.namereduce.semantic.index;

import me.christianrobert.namereduce.grammar.Grammar;
import me.christianrobert.namereduce.semantic.ResolvedSymbol;
import me.christianrobert.namereduce.semantic.SymbolKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds a {@link SymbolIndex}.
 *
 * <p>Usage:
 * <pre>
 * SymbolIndex index = SymbolIndexBuilder.forGrammar(Grammar.CSHARP)
 *     .addType("System.Console")
 *     .addMember("System.Console.WriteLine")
 *     .addType("System.Text.StringBuilder")
 *     .build();
 * </pre>
 *
 * <p>Containers are registered implicitly: adding {@code System.Text.StringBuilder} also
 * registers the namespaces {@code System} and {@code System.Text} unless they are known
 * already (a known type stays a type, which is how nested types are expressed).</p>
 */
public class SymbolIndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(SymbolIndexBuilder.class);

    private final Grammar grammar;
    private final Map<String, ResolvedSymbol> symbols = new HashMap<>();

    private SymbolIndexBuilder(Grammar grammar) {
        this.grammar = grammar;
    }

    public static SymbolIndexBuilder forGrammar(Grammar grammar) {
        if (grammar == null) {
            throw new IllegalArgumentException("Grammar cannot be null");
        }
        return new SymbolIndexBuilder(grammar);
    }

    public SymbolIndexBuilder addNamespace(String qualifiedName) {
        register(SymbolKind.NAMESPACE, qualifiedName);
        return this;
    }

    public SymbolIndexBuilder addType(String qualifiedName) {
        register(SymbolKind.TYPE, qualifiedName);
        return this;
    }

    /**
     * Adds a member (method, property, field). Its container must be a known type.
     */
    public SymbolIndexBuilder addMember(String qualifiedName) {
        int lastDot = qualifiedName != null ? qualifiedName.lastIndexOf('.') : -1;
        if (lastDot < 0) {
            throw new IllegalArgumentException("Member needs a containing type: " + qualifiedName);
        }
        ResolvedSymbol container = symbols.get(grammar.normalizeName(qualifiedName.substring(0, lastDot)));
        if (container == null || !container.isType()) {
            throw new IllegalArgumentException("Containing type of member " + qualifiedName + " is not a known type");
        }
        register(SymbolKind.MEMBER, qualifiedName);
        return this;
    }

    private void register(SymbolKind kind, String qualifiedName) {
        if (qualifiedName == null || qualifiedName.trim().isEmpty()) {
            throw new IllegalArgumentException("Qualified name cannot be null or empty");
        }

        int lastDot = qualifiedName.lastIndexOf('.');
        if (lastDot > 0 && kind != SymbolKind.MEMBER) {
            String container = qualifiedName.substring(0, lastDot);
            if (!symbols.containsKey(grammar.normalizeName(container))) {
                register(SymbolKind.NAMESPACE, container);
            }
        }

        String key = grammar.normalizeName(qualifiedName);
        ResolvedSymbol existing = symbols.get(key);
        if (existing != null) {
            if (existing.getKind() != kind) {
                throw new IllegalArgumentException("Symbol " + qualifiedName + " is already registered as "
                        + existing.getKind() + ", cannot register it as " + kind);
            }
            return;
        }
        symbols.put(key, new ResolvedSymbol(kind, qualifiedName));
    }

    public SymbolIndex build() {
        log.debug("Built {} symbol index with {} symbols", grammar.getDisplayName(), symbols.size());
        return new SymbolIndex(grammar, symbols);
    }
}

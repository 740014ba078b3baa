package me.christianrobert.namereduce.semantic.index;

import me.christianrobert.namereduce.grammar.Grammar;
import me.christianrobert.namereduce.semantic.ResolvedSymbol;
import me.christianrobert.namereduce.syntax.SyntaxKind;
import me.christianrobert.namereduce.syntax.SyntaxNode;
import me.christianrobert.namereduce.syntax.SyntaxTree;
import me.christianrobert.namereduce.syntax.util.NameSyntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Binds dotted names of one tree snapshot against a {@link SymbolIndex}.
 *
 * <p>Lookup order for the first segment of a name:</p>
 * <ol>
 *   <li>each enclosing namespace, innermost first (a declaration {@code namespace A.B}
 *       encloses both {@code A.B} and {@code A})</li>
 *   <li>the global namespace</li>
 *   <li>the imported namespaces, all at the same level: more than one hit is ambiguous</li>
 * </ol>
 * <p>Imports contribute types only, unless the grammar lets imports expose nested namespaces.
 * A bare first segment never binds to a member. Following segments bind to children of the
 * previous symbol.</p>
 */
public class NameResolver {

    private final SymbolIndex index;
    private final SyntaxTree tree;
    private final Grammar grammar;
    private final List<ResolvedSymbol> importedNamespaces;

    public NameResolver(SymbolIndex index, SyntaxTree tree) {
        this.index = index;
        this.tree = tree;
        this.grammar = tree.getGrammar();
        this.importedNamespaces = collectImports();
    }

    private List<ResolvedSymbol> collectImports() {
        List<ResolvedSymbol> imports = new ArrayList<>();
        for (SyntaxNode node : tree.descendantNodes(n -> n.getKind() != SyntaxKind.IMPORT_DIRECTIVE)) {
            if (node.getKind() == SyntaxKind.IMPORT_DIRECTIVE) {
                ResolvedSymbol imported = resolveImport(node);
                if (imported != null && !imports.contains(imported)) {
                    imports.add(imported);
                }
            }
        }
        return Collections.unmodifiableList(imports);
    }

    public List<ResolvedSymbol> getImportedNamespaces() {
        return importedNamespaces;
    }

    /**
     * Resolves the namespace named by an import directive. Import names are always fully
     * qualified.
     *
     * @return The namespace, or null if the directive names nothing known
     */
    public ResolvedSymbol resolveImport(SyntaxNode importDirective) {
        List<String> segments = NameSyntax.dottedSegments(importDirective.getFirstNameChild());
        if (segments == null) {
            return null;
        }
        ResolvedSymbol symbol = index.lookup(NameSyntax.dottedText(segments));
        return symbol != null && symbol.isNamespace() ? symbol : null;
    }

    /**
     * Resolves a name node of the snapshot.
     *
     * @return The symbol, or null if the node is not a dotted name or does not bind
     */
    public ResolvedSymbol resolve(SyntaxNode nameNode) {
        List<String> segments = NameSyntax.dottedSegments(nameNode);
        if (segments == null) {
            return null;
        }
        if (NameSyntax.isInImportDirective(nameNode, tree)) {
            return index.lookup(NameSyntax.dottedText(segments));
        }
        return resolveSegments(segments, enclosingNamespaces(nameNode));
    }

    /**
     * Fully qualified names of the namespaces enclosing a node, innermost first.
     */
    public List<String> enclosingNamespaces(SyntaxNode node) {
        List<SyntaxNode> declarations = new ArrayList<>();
        for (SyntaxNode ancestor : tree.getAncestors(node)) {
            if (ancestor.getKind() == SyntaxKind.NAMESPACE_DECLARATION) {
                declarations.add(0, ancestor);
            }
        }

        List<String> levels = new ArrayList<>();
        String prefix = null;
        for (SyntaxNode declaration : declarations) {
            List<String> segments = NameSyntax.dottedSegments(declaration.getFirstNameChild());
            if (segments == null) {
                continue;
            }
            for (String segment : segments) {
                prefix = prefix == null ? segment : prefix + "." + segment;
                levels.add(0, prefix);
            }
        }
        return levels;
    }

    /**
     * Binds name segments as if written at a place enclosed by the given namespaces.
     */
    public ResolvedSymbol resolveSegments(List<String> segments, List<String> enclosingNamespaces) {
        if (segments == null || segments.isEmpty()) {
            return null;
        }
        ResolvedSymbol current = resolveFirstSegment(segments.get(0), enclosingNamespaces);
        for (int i = 1; i < segments.size() && current != null; i++) {
            current = index.lookupChild(current, segments.get(i));
        }
        return current;
    }

    private ResolvedSymbol resolveFirstSegment(String segment, List<String> enclosingNamespaces) {
        for (String namespace : enclosingNamespaces) {
            ResolvedSymbol candidate = index.lookup(namespace + "." + segment);
            if (candidate != null && !candidate.isMember()) {
                return candidate;
            }
        }

        ResolvedSymbol global = index.lookup(segment);
        if (global != null && !global.isMember()) {
            return global;
        }

        Set<ResolvedSymbol> imported = new LinkedHashSet<>();
        for (ResolvedSymbol namespace : importedNamespaces) {
            ResolvedSymbol candidate = index.lookupChild(namespace, segment);
            if (candidate == null) {
                continue;
            }
            if (candidate.isType() || (candidate.isNamespace() && grammar.importsExposeNamespaces())) {
                imported.add(candidate);
            }
        }
        return imported.size() == 1 ? imported.iterator().next() : null;
    }

    /**
     * Shortest trailing part of the symbol's qualified name that still binds to the symbol
     * at the given place.
     *
     * @return The segments, or null if not even the fully qualified name binds there
     */
    public List<String> minimalSegments(ResolvedSymbol target, List<String> enclosingNamespaces) {
        List<String> full = target.getSegments();
        for (int start = full.size() - 1; start >= 0; start--) {
            List<String> suffix = new ArrayList<>(full.subList(start, full.size()));
            if (target.equals(resolveSegments(suffix, enclosingNamespaces))) {
                return suffix;
            }
        }
        return null;
    }
}

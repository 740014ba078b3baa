package me.christianrobert.namereduce.semantic.index;

import me.christianrobert.namereduce.semantic.ResolvedSymbol;
import me.christianrobert.namereduce.syntax.SyntaxAnnotation;
import me.christianrobert.namereduce.syntax.SyntaxFactory;
import me.christianrobert.namereduce.syntax.SyntaxKind;
import me.christianrobert.namereduce.syntax.SyntaxNode;
import me.christianrobert.namereduce.syntax.SyntaxTree;
import me.christianrobert.namereduce.syntax.util.NameSyntax;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shortens the dotted names inside marked subtrees to the shortest form that still binds to
 * the same symbol, then removes all simplifier markers.
 *
 * <p>Names inside import directives and namespace declaration names are left alone. A
 * shortened name keeps its kind, its trailing trivia and any annotations it carried.</p>
 */
public class MinimalFormReducer {

    private static final Logger log = LoggerFactory.getLogger(MinimalFormReducer.class);

    private final SymbolIndex index;

    public MinimalFormReducer(SymbolIndex index) {
        this.index = index;
    }

    public SyntaxTree reduce(SyntaxTree markedTree) {
        NameResolver resolver = new NameResolver(index, markedTree);

        List<SyntaxNode> targets = new ArrayList<>();
        collectTargets(markedTree.getRoot(), false, markedTree, targets);

        Map<SyntaxNode, SyntaxNode> replacements = new IdentityHashMap<>();
        for (SyntaxNode target : targets) {
            SyntaxNode shortened = shorten(target, resolver);
            if (shortened != null) {
                replacements.put(target, shortened);
            }
        }
        log.debug("Shortening {} of {} marked names in {}", replacements.size(), targets.size(),
                markedTree.getDocumentName());

        SyntaxNode reduced = markedTree.getRoot().replaceNodes(replacements.keySet(),
                (original, rewritten) -> replacements.get(original));
        return markedTree.withRoot(stripMarkers(reduced));
    }

    private static void collectTargets(SyntaxNode node, boolean insideMarked, SyntaxTree tree,
                                       List<SyntaxNode> targets) {
        if (node.isToken() || node.getKind() == SyntaxKind.IMPORT_DIRECTIVE) {
            return;
        }
        boolean marked = insideMarked || node.hasAnnotations(SyntaxAnnotation.SIMPLIFY_KIND);
        if (NameSyntax.isDottedName(node)) {
            if (marked && !NameSyntax.isDeclarationName(node, tree) && !NameSyntax.isRightOfDot(node, tree)) {
                targets.add(node);
            }
            return;
        }
        for (SyntaxNode child : node.getChildren()) {
            collectTargets(child, marked, tree, targets);
        }
    }

    private static SyntaxNode shorten(SyntaxNode name, NameResolver resolver) {
        ResolvedSymbol symbol = resolver.resolve(name);
        if (symbol == null) {
            return null;
        }
        List<String> current = NameSyntax.dottedSegments(name);
        List<String> minimal = resolver.minimalSegments(symbol, resolver.enclosingNamespaces(name));
        if (minimal == null || minimal.size() >= current.size()) {
            return null;
        }
        return SyntaxFactory.dottedName(name.getKind(), minimal)
                .withTrailingTrivia(name.getTrailingTrivia())
                .withAdditionalAnnotations(name.getAnnotations());
    }

    private static SyntaxNode stripMarkers(SyntaxNode root) {
        List<SyntaxNode> marked = new ArrayList<>();
        for (SyntaxNode node : root.descendantNodesAndSelf()) {
            if (node.hasAnnotations(SyntaxAnnotation.SIMPLIFY_KIND)) {
                marked.add(node);
            }
        }
        return root.replaceNodes(marked,
                (original, rewritten) -> rewritten.withoutAnnotations(SyntaxAnnotation.SIMPLIFY_KIND));
    }
}

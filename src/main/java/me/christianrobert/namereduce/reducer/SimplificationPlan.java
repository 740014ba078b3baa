package me.christianrobert.namereduce.reducer;

import me.christianrobert.namereduce.grammar.Grammar;
import me.christianrobert.namereduce.reducer.exclusion.UnsafeShapeRule;
import me.christianrobert.namereduce.semantic.Diagnostic;
import me.christianrobert.namereduce.syntax.SyntaxKind;
import me.christianrobert.namereduce.syntax.SyntaxNode;
import me.christianrobert.namereduce.syntax.SyntaxTree;
import me.christianrobert.namereduce.syntax.TextSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Which nodes of one tree snapshot get the simplifier marker.
 *
 * <p>Built in three steps:</p>
 * <ol>
 *   <li>Diagnostics with the unresolved-name id are mapped onto their snapshot and then to
 *       the import directive enclosing the located node. Those imports are flagged.</li>
 *   <li>Candidates are collected by a pruning descent from the root that does not look
 *       below expressions, flagged imports or unsafe shapes (those nodes themselves are
 *       still candidates).</li>
 *   <li>Every flagged or unsafe candidate excludes itself and all its ancestors. The
 *       remaining candidates are eligible.</li>
 * </ol>
 *
 * <p>All node sets are identity based.</p>
 */
public final class SimplificationPlan {

    private static final Logger log = LoggerFactory.getLogger(SimplificationPlan.class);

    private final List<SyntaxNode> candidates;
    private final Set<SyntaxNode> unresolvedImports;
    private final Set<SyntaxNode> excluded;
    private final List<SyntaxNode> eligible;

    private SimplificationPlan(List<SyntaxNode> candidates, Set<SyntaxNode> unresolvedImports,
                               Set<SyntaxNode> excluded, List<SyntaxNode> eligible) {
        this.candidates = Collections.unmodifiableList(candidates);
        this.unresolvedImports = Collections.unmodifiableSet(unresolvedImports);
        this.excluded = Collections.unmodifiableSet(excluded);
        this.eligible = Collections.unmodifiableList(eligible);
    }

    /**
     * Plans the simplification of a snapshot.
     *
     * @param tree Snapshot the diagnostics were computed for
     * @param diagnostics Diagnostics of that snapshot
     * @param unresolvedDiagnosticId Id of the "type or namespace not found" diagnostic
     * @param unsafeShapeRule Shapes the reducer must not touch
     */
    public static SimplificationPlan create(SyntaxTree tree, List<Diagnostic> diagnostics,
                                            String unresolvedDiagnosticId, UnsafeShapeRule unsafeShapeRule) {
        Set<SyntaxNode> unresolvedImports = findUnresolvedImports(tree, diagnostics, unresolvedDiagnosticId);
        Grammar grammar = tree.getGrammar();

        List<SyntaxNode> candidates = tree.descendantNodes(node ->
                !grammar.isExpression(node)
                        && !unresolvedImports.contains(node)
                        && !unsafeShapeRule.isUnsafeToSimplify(node));

        Set<SyntaxNode> excluded = identitySet();
        for (SyntaxNode candidate : candidates) {
            if (unresolvedImports.contains(candidate) || unsafeShapeRule.isUnsafeToSimplify(candidate)) {
                excluded.addAll(tree.getAncestorsAndSelf(candidate));
            }
        }

        List<SyntaxNode> eligible = new ArrayList<>();
        for (SyntaxNode candidate : candidates) {
            if (!excluded.contains(candidate)) {
                eligible.add(candidate);
            }
        }

        log.debug("Simplification plan for {}: {} candidates, {} unresolved imports, {} excluded, {} eligible",
                tree.getDocumentName(), candidates.size(), unresolvedImports.size(), excluded.size(), eligible.size());
        return new SimplificationPlan(candidates, unresolvedImports, excluded, eligible);
    }

    private static Set<SyntaxNode> findUnresolvedImports(SyntaxTree tree, List<Diagnostic> diagnostics,
                                                         String unresolvedDiagnosticId) {
        Set<SyntaxNode> imports = identitySet();
        if (diagnostics == null) {
            return imports;
        }
        TextSpan documentSpan = tree.getFullSpan(tree.getRoot());
        for (Diagnostic diagnostic : diagnostics) {
            if (!diagnostic.getId().equals(unresolvedDiagnosticId) || !diagnostic.isInSource()) {
                continue;
            }
            if (!documentSpan.contains(diagnostic.getSpan())) {
                log.debug("Ignoring diagnostic {} outside of {}", diagnostic, tree.getDocumentName());
                continue;
            }
            SyntaxNode located = tree.findNode(diagnostic.getSpan());
            SyntaxNode importDirective = tree.getFirstAncestor(located, SyntaxKind.IMPORT_DIRECTIVE);
            if (importDirective != null) {
                imports.add(importDirective);
            }
        }
        return imports;
    }

    private static Set<SyntaxNode> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    /**
     * Nodes visited by the pruning descent, in document order.
     */
    public List<SyntaxNode> getCandidates() {
        return candidates;
    }

    public Set<SyntaxNode> getUnresolvedImports() {
        return unresolvedImports;
    }

    /**
     * Flagged and unsafe candidates plus all their ancestors.
     */
    public Set<SyntaxNode> getExcluded() {
        return excluded;
    }

    public List<SyntaxNode> getEligible() {
        return eligible;
    }

    public boolean isEmpty() {
        return eligible.isEmpty();
    }
}

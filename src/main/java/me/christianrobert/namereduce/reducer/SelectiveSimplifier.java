package me.christianrobert.namereduce.reducer;

import me.christianrobert.namereduce.context.WarningAnnotations;
import me.christianrobert.namereduce.core.tools.FutureUtils;
import me.christianrobert.namereduce.reducer.exclusion.UnsafeShapeRule;
import me.christianrobert.namereduce.semantic.SemanticOracle;
import me.christianrobert.namereduce.semantic.SemanticOracleException;
import me.christianrobert.namereduce.syntax.SyntaxAnnotation;
import me.christianrobert.namereduce.syntax.SyntaxNode;
import me.christianrobert.namereduce.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Marks the nodes of a tree that are safe to shorten and lets the oracle reduce them.
 *
 * <p>Import directives the oracle cannot resolve are left alone, since shortening names
 * around them could silently rebind those names. Shapes listed by the {@link UnsafeShapeRule}
 * are left alone too, and so is every ancestor of an excluded node.</p>
 *
 * <p>Failures have document granularity: if the diagnostics or the reduction fail, the
 * input tree comes back with one conversion warning on its root. The returned future never
 * completes exceptionally.</p>
 */
public class SelectiveSimplifier {

    private static final Logger log = LoggerFactory.getLogger(SelectiveSimplifier.class);

    private final UnsafeShapeRule unsafeShapeRule;

    public SelectiveSimplifier(UnsafeShapeRule unsafeShapeRule) {
        this.unsafeShapeRule = unsafeShapeRule != null ? unsafeShapeRule : UnsafeShapeRule.NONE;
    }

    public UnsafeShapeRule getUnsafeShapeRule() {
        return unsafeShapeRule;
    }

    /**
     * Simplifies qualified names of a tree.
     *
     * @param tree Tree to simplify
     * @param oracle Semantic oracle for the tree's grammar
     * @param unresolvedDiagnosticId Diagnostic id for an unresolved type or namespace name
     * @return The simplified tree, or the input tree annotated with a document-level warning
     */
    public CompletableFuture<SyntaxTree> simplify(SyntaxTree tree, SemanticOracle oracle, String unresolvedDiagnosticId) {
        if (tree == null) {
            throw new IllegalArgumentException("Tree cannot be null");
        }
        if (oracle == null) {
            throw new IllegalArgumentException("Semantic oracle cannot be null");
        }
        log.debug("Simplifying qualified names in {}", tree.getDocumentName());

        return FutureUtils.call(() -> oracle.getDiagnostics(tree))
                .thenCompose(diagnostics -> {
                    SimplificationPlan plan = SimplificationPlan.create(tree, diagnostics, unresolvedDiagnosticId,
                            unsafeShapeRule);
                    if (plan.isEmpty()) {
                        log.debug("Nothing to simplify in {}", tree.getDocumentName());
                        return CompletableFuture.completedFuture(tree);
                    }
                    SyntaxNode markedRoot = tree.getRoot().replaceNodes(plan.getEligible(),
                            (original, rewritten) -> rewritten.withAdditionalAnnotations(SyntaxAnnotation.SIMPLIFIER_MARKER));
                    SyntaxTree markedTree = tree.withRoot(markedRoot);
                    return FutureUtils.call(() -> oracle.reduceToMinimalForm(markedTree));
                })
                .thenApply(reduced -> {
                    if (reduced == null) {
                        throw new SemanticOracleException("Reduction returned no tree",
                                tree.getDocumentName(), "reduceToMinimalForm");
                    }
                    log.trace("Simplified {}:\n{}", tree.getDocumentName(), reduced.getText());
                    return reduced;
                })
                .exceptionally(error -> {
                    Throwable cause = FutureUtils.unwrap(error);
                    log.warn("Qualified name reduction failed for {}", tree.getDocumentName(), cause);
                    return WarningAnnotations.withDocumentWarning(tree, cause);
                });
    }
}

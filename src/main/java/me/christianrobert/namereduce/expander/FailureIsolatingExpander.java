package me.christianrobert.namereduce.expander;

import me.christianrobert.namereduce.context.NodeConversionException;
import me.christianrobert.namereduce.context.ReductionException;
import me.christianrobert.namereduce.context.WarningAnnotations;
import me.christianrobert.namereduce.core.tools.FutureUtils;
import me.christianrobert.namereduce.semantic.SemanticModel;
import me.christianrobert.namereduce.semantic.SemanticOracle;
import me.christianrobert.namereduce.semantic.SemanticOracleException;
import me.christianrobert.namereduce.syntax.SyntaxNode;
import me.christianrobert.namereduce.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Expands the names of a tree to their fully qualified form, isolating failures.
 *
 * <p>Two failure granularities:</p>
 * <ul>
 *   <li>Node: when {@link SyntaxExpander#expandNode} throws, that node stays as it is and
 *       gets a conversion warning; all other nodes are still expanded.</li>
 *   <li>Document: when the semantic model cannot be obtained or the traversal itself fails,
 *       the original tree comes back with one conversion warning on its root, and no
 *       node-level result of this pass is kept.</li>
 * </ul>
 * <p>The returned future never completes exceptionally.</p>
 */
public class FailureIsolatingExpander {

    private static final Logger log = LoggerFactory.getLogger(FailureIsolatingExpander.class);

    public CompletableFuture<SyntaxTree> expand(SyntaxTree tree, SemanticOracle oracle, SyntaxExpander expander) {
        if (tree == null) {
            throw new IllegalArgumentException("Tree cannot be null");
        }
        if (oracle == null || expander == null) {
            throw new IllegalArgumentException("Semantic oracle and expander are required");
        }
        log.debug("Expanding names in {} with {}", tree.getDocumentName(), expander.getClass().getSimpleName());

        return FutureUtils.call(() -> oracle.getSemanticModel(tree))
                .thenApply(model -> expandWithModel(tree, model, expander))
                .exceptionally(error -> {
                    Throwable cause = FutureUtils.unwrap(error);
                    log.warn("Name expansion failed for {}", tree.getDocumentName(), cause);
                    return WarningAnnotations.withDocumentWarning(tree, cause);
                });
    }

    private SyntaxTree expandWithModel(SyntaxTree tree, SemanticModel model, SyntaxExpander expander) {
        if (model == null) {
            throw new SemanticOracleException("Oracle returned no semantic model",
                    tree.getDocumentName(), "getSemanticModel");
        }

        List<SyntaxNode> selected = new ArrayList<>();
        for (SyntaxNode node : tree.descendantNodes(n -> expander.shouldExpandWithinNode(n, tree, model))) {
            if (expander.shouldExpandNode(node, tree, model)) {
                selected.add(node);
            }
        }

        AtomicInteger failures = new AtomicInteger();
        SyntaxNode expandedRoot = tree.getRoot().replaceNodes(selected,
                (original, rewritten) -> tryExpandNode(original, rewritten, tree, model, expander, failures));

        log.debug("Expanded {} of {} names in {} ({} failed)", selected.size() - failures.get(), selected.size(),
                tree.getDocumentName(), failures.get());
        SyntaxTree expanded = tree.withRoot(expandedRoot);
        log.trace("Expanded {}:\n{}", tree.getDocumentName(), expanded.getText());
        return expanded;
    }

    private SyntaxNode tryExpandNode(SyntaxNode original, SyntaxNode rewritten, SyntaxTree tree,
                                     SemanticModel model, SyntaxExpander expander, AtomicInteger failures) {
        try {
            SyntaxNode expanded = expander.expandNode(original, tree, model);
            if (expanded == null) {
                throw new ReductionException("Expansion produced no node", tree.getDocumentName(),
                        original.getKind().name());
            }
            return expanded;
        } catch (Exception e) {
            failures.incrementAndGet();
            log.warn("Could not expand {} in {}: {}", original, tree.getDocumentName(), e.getMessage());
            NodeConversionException failure =
                    new NodeConversionException(e, original, tree.getSpan(original), WarningAnnotations.WARNING_PREFIX);
            // Annotate the rewritten node, not the original: expansions already done below it are kept
            return WarningAnnotations.withWarning(rewritten, failure.toString());
        }
    }
}

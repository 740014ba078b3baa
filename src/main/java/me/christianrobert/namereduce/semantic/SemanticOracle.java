package me.christianrobert.namereduce.semantic;

import me.christianrobert.namereduce.syntax.SyntaxTree;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Semantic analyzer consumed by the expansion and simplification passes.
 *
 * <p>Implementations may be expensive and may have defects of their own. Any method may fail
 * for the whole document, either by throwing or by completing its future exceptionally;
 * callers treat both the same way.</p>
 *
 * @see me.christianrobert.namereduce.semantic.index.IndexedSemanticOracle
 */
public interface SemanticOracle {

    /**
     * Computes the diagnostics of a tree snapshot.
     */
    CompletableFuture<List<Diagnostic>> getDiagnostics(SyntaxTree tree);

    /**
     * Computes the semantic model of a tree snapshot.
     */
    CompletableFuture<SemanticModel> getSemanticModel(SyntaxTree tree);

    /**
     * Rewrites every subtree carrying the
     * {@link me.christianrobert.namereduce.syntax.SyntaxAnnotation#SIMPLIFIER_MARKER} to its
     * minimal legal form and removes the markers.
     *
     * @param markedTree Tree whose nodes to simplify are marked
     * @return The reduced tree
     */
    CompletableFuture<SyntaxTree> reduceToMinimalForm(SyntaxTree markedTree);
}

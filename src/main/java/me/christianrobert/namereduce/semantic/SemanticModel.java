package me.christianrobert.namereduce.semantic;

import me.christianrobert.namereduce.syntax.SyntaxNode;
import me.christianrobert.namereduce.syntax.SyntaxTree;

import java.util.List;
import java.util.Optional;

/**
 * Semantic information computed by a {@link SemanticOracle} for one tree snapshot.
 *
 * <p>Treated as opaque by the rewriting passes: it is handed through to the expansion
 * policies, which are the only code asking it about individual nodes.</p>
 */
public interface SemanticModel {

    /**
     * The snapshot this model was computed for.
     */
    SyntaxTree getSyntaxTree();

    /**
     * Resolves a name node of this snapshot.
     *
     * @param node A node of {@link #getSyntaxTree()}
     * @return The symbol the node refers to, or empty if it does not resolve (or is not a name)
     */
    Optional<ResolvedSymbol> getSymbol(SyntaxNode node);

    /**
     * All diagnostics of the snapshot.
     */
    List<Diagnostic> getDiagnostics();
}

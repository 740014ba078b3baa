package me.christianrobert.namereduce.expander;

import me.christianrobert.namereduce.grammar.Grammar;
import me.christianrobert.namereduce.semantic.SemanticModel;
import me.christianrobert.namereduce.syntax.SyntaxNode;
import me.christianrobert.namereduce.syntax.SyntaxTree;

/**
 * Grammar-specific policy deciding which names get expanded and how.
 *
 * <p>Called by {@link FailureIsolatingExpander}, which handles traversal, replacement and
 * failures. Implementations only answer questions about single nodes of the given snapshot
 * and may throw from {@link #expandNode}; the failure is then recorded on that node.</p>
 */
public interface SyntaxExpander {

    Grammar getGrammar();

    /**
     * Whether the traversal should look at the children of this node.
     */
    boolean shouldExpandWithinNode(SyntaxNode node, SyntaxTree tree, SemanticModel semanticModel);

    /**
     * Whether this node should be replaced by its expanded form.
     */
    boolean shouldExpandNode(SyntaxNode node, SyntaxTree tree, SemanticModel semanticModel);

    /**
     * Builds the expanded form of a node selected by {@link #shouldExpandNode}.
     *
     * @param node The node as it appears in {@code tree}
     * @param tree The snapshot the semantic model was computed for
     * @param semanticModel Model of {@code tree}
     * @return The replacement node, never null
     */
    SyntaxNode expandNode(SyntaxNode node, SyntaxTree tree, SemanticModel semanticModel);
}

package me.christianrobert.namereduce.syntax;

import me.christianrobert.namereduce.grammar.Grammar;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * One immutable snapshot of a translated document.
 *
 * <p>Wraps a root {@link SyntaxNode} together with the document's {@link Grammar} and the
 * positional information nodes do not carry themselves: parent links and absolute offsets.
 * Both are indexed by node identity when the snapshot is created, so lookups are O(1).</p>
 *
 * <p>Positional answers are only valid for nodes of this snapshot. A node instance may
 * appear at most once in a tree; the same instance may be shared with other snapshots.</p>
 */
public final class SyntaxTree {

    private final String documentName;
    private final Grammar grammar;
    private final SyntaxNode root;

    private final Map<SyntaxNode, SyntaxNode> parents = new IdentityHashMap<>();
    private final Map<SyntaxNode, Integer> positions = new IdentityHashMap<>();

    public SyntaxTree(String documentName, Grammar grammar, SyntaxNode root) {
        if (grammar == null) {
            throw new IllegalArgumentException("Grammar cannot be null");
        }
        if (root == null) {
            throw new IllegalArgumentException("Root node cannot be null");
        }
        this.documentName = documentName != null ? documentName : "<unnamed>";
        this.grammar = grammar;
        this.root = root;
        index(root, null, 0);
    }

    private int index(SyntaxNode node, SyntaxNode parent, int position) {
        if (positions.containsKey(node)) {
            throw new IllegalArgumentException(
                    "Node instance appears more than once in tree " + documentName + ": " + node.getKind());
        }
        positions.put(node, position);
        if (parent != null) {
            parents.put(node, parent);
        }
        int offset = position;
        for (SyntaxNode child : node.getChildren()) {
            offset = index(child, node, offset);
        }
        return position + node.getFullWidth();
    }

    /**
     * Creates a new snapshot of the same document with a different root.
     */
    public SyntaxTree withRoot(SyntaxNode newRoot) {
        if (newRoot == root) {
            return this;
        }
        return new SyntaxTree(documentName, grammar, newRoot);
    }

    public String getDocumentName() {
        return documentName;
    }

    public Grammar getGrammar() {
        return grammar;
    }

    public SyntaxNode getRoot() {
        return root;
    }

    public String getText() {
        return root.toFullString();
    }

    public boolean contains(SyntaxNode node) {
        return node != null && positions.containsKey(node);
    }

    // ==================== NAVIGATION ====================

    /**
     * Parent of the node, or null for the root.
     */
    public SyntaxNode getParent(SyntaxNode node) {
        requireMember(node);
        return parents.get(node);
    }

    /**
     * Ancestors of the node, nearest first. The node itself is not included.
     */
    public List<SyntaxNode> getAncestors(SyntaxNode node) {
        requireMember(node);
        List<SyntaxNode> ancestors = new ArrayList<>();
        SyntaxNode current = parents.get(node);
        while (current != null) {
            ancestors.add(current);
            current = parents.get(current);
        }
        return ancestors;
    }

    /**
     * The node followed by its ancestors, nearest first.
     */
    public List<SyntaxNode> getAncestorsAndSelf(SyntaxNode node) {
        List<SyntaxNode> result = new ArrayList<>();
        result.add(node);
        result.addAll(getAncestors(node));
        return result;
    }

    /**
     * Nearest ancestor of the given kind, starting at the parent. Null if there is none.
     */
    public SyntaxNode getFirstAncestor(SyntaxNode node, SyntaxKind kind) {
        requireMember(node);
        SyntaxNode current = parents.get(node);
        while (current != null) {
            if (current.getKind() == kind) {
                return current;
            }
            current = parents.get(current);
        }
        return null;
    }

    public List<SyntaxNode> descendantNodes(Predicate<SyntaxNode> descendIntoChildren) {
        return root.descendantNodes(descendIntoChildren);
    }

    // ==================== POSITIONS ====================

    /**
     * Span including the trailing trivia of the node's last token.
     */
    public TextSpan getFullSpan(SyntaxNode node) {
        requireMember(node);
        return new TextSpan(positions.get(node), node.getFullWidth());
    }

    /**
     * Span of the node's text, without trailing trivia.
     */
    public TextSpan getSpan(SyntaxNode node) {
        requireMember(node);
        return new TextSpan(positions.get(node), node.getWidth());
    }

    /**
     * Finds the node with the smallest full span that contains the given span.
     * When several nested nodes share that span, the outermost one is returned.
     * Tokens are never returned.
     *
     * @throws IllegalArgumentException if the span is outside the tree
     */
    public SyntaxNode findNode(TextSpan span) {
        if (!getFullSpan(root).contains(span)) {
            throw new IllegalArgumentException("Span " + span + " is outside of document " + documentName);
        }

        SyntaxNode current = root;
        boolean descended = true;
        while (descended) {
            descended = false;
            for (SyntaxNode child : current.getChildren()) {
                if (!child.isToken() && getFullSpan(child).contains(span)) {
                    current = child;
                    descended = true;
                    break;
                }
            }
        }

        TextSpan found = getFullSpan(current);
        SyntaxNode parent = parents.get(current);
        while (parent != null && getFullSpan(parent).equals(found)) {
            current = parent;
            parent = parents.get(current);
        }
        return current;
    }

    private void requireMember(SyntaxNode node) {
        if (!contains(node)) {
            throw new IllegalArgumentException("Node does not belong to tree " + documentName + ": " + node);
        }
    }

    @Override
    public String toString() {
        return "SyntaxTree{document='" + documentName + "', grammar=" + grammar + "}";
    }
}

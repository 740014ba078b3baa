package me.christianrobert.namereduce.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Immutable element of a syntax tree.
 *
 * <p>A node is either a token (kind {@link SyntaxKind#TOKEN}, carrying text and trailing
 * trivia) or a composite node with an ordered list of children. The text of a node is the
 * concatenation of its tokens.</p>
 *
 * <p>Nodes never change after construction. Every "with" method and
 * {@link #replaceNodes(Collection, BiFunction)} returns a new node that shares all unmodified
 * children with the original. Equality is identity: two structurally equal nodes at different
 * positions are different nodes. Use {@link #isEquivalentTo(SyntaxNode)} for structural
 * comparison.</p>
 */
public final class SyntaxNode {

    private final SyntaxKind kind;
    private final String tokenText;
    private final String trailingTrivia;
    private final List<SyntaxNode> children;
    private final List<SyntaxAnnotation> annotations;
    private final int fullWidth;

    private SyntaxNode(SyntaxKind kind, String tokenText, String trailingTrivia,
                       List<SyntaxNode> children, List<SyntaxAnnotation> annotations) {
        this.kind = kind;
        this.tokenText = tokenText;
        this.trailingTrivia = trailingTrivia;
        this.children = children;
        this.annotations = annotations;
        this.fullWidth = computeFullWidth();
    }

    /**
     * Creates a token without trailing trivia.
     */
    public static SyntaxNode token(String text) {
        return token(text, "");
    }

    /**
     * Creates a token.
     *
     * @param text Token text (keyword, identifier, punctuation or literal)
     * @param trailingTrivia Whitespace following the token (never null)
     */
    public static SyntaxNode token(String text, String trailingTrivia) {
        if (text == null) {
            throw new IllegalArgumentException("Token text cannot be null");
        }
        return new SyntaxNode(SyntaxKind.TOKEN, text, trailingTrivia != null ? trailingTrivia : "",
                Collections.emptyList(), Collections.emptyList());
    }

    public static SyntaxNode node(SyntaxKind kind, SyntaxNode... children) {
        return node(kind, Arrays.asList(children));
    }

    public static SyntaxNode node(SyntaxKind kind, List<SyntaxNode> children) {
        if (kind == null || kind.isToken()) {
            throw new IllegalArgumentException("Composite node needs a non-token kind, got: " + kind);
        }
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException("Composite node " + kind + " needs at least one child");
        }
        for (SyntaxNode child : children) {
            if (child == null) {
                throw new IllegalArgumentException("Composite node " + kind + " cannot have null children");
            }
        }
        return new SyntaxNode(kind, null, null, List.copyOf(children), Collections.emptyList());
    }

    private int computeFullWidth() {
        if (isToken()) {
            return tokenText.length() + trailingTrivia.length();
        }
        int width = 0;
        for (SyntaxNode child : children) {
            width += child.fullWidth;
        }
        return width;
    }

    // ==================== ACCESSORS ====================

    public SyntaxKind getKind() {
        return kind;
    }

    public boolean isToken() {
        return kind.isToken();
    }

    /**
     * Token text, or null for composite nodes.
     */
    public String getTokenText() {
        return tokenText;
    }

    /**
     * Trailing trivia of a token, or of the last token of a composite node.
     */
    public String getTrailingTrivia() {
        return isToken() ? trailingTrivia : getLastToken().trailingTrivia;
    }

    public List<SyntaxNode> getChildren() {
        return children;
    }

    /**
     * Children that are not tokens.
     */
    public List<SyntaxNode> getChildNodes() {
        return children.stream()
                .filter(child -> !child.isToken())
                .collect(Collectors.toList());
    }

    /**
     * First direct child of the given kind, or null.
     */
    public SyntaxNode getFirstChild(SyntaxKind childKind) {
        for (SyntaxNode child : children) {
            if (child.kind == childKind) {
                return child;
            }
        }
        return null;
    }

    /**
     * First direct child that is a name (identifier, qualified name or member access), or null.
     */
    public SyntaxNode getFirstNameChild() {
        for (SyntaxNode child : children) {
            if (child.kind.isName()) {
                return child;
            }
        }
        return null;
    }

    public SyntaxNode getLastToken() {
        SyntaxNode current = this;
        while (!current.isToken()) {
            current = current.children.get(current.children.size() - 1);
        }
        return current;
    }

    public int getFullWidth() {
        return fullWidth;
    }

    /**
     * Width without the trailing trivia of the last token.
     */
    public int getWidth() {
        return fullWidth - getTrailingTrivia().length();
    }

    /**
     * Text including the trailing trivia of the last token.
     */
    public String toFullString() {
        StringBuilder sb = new StringBuilder(fullWidth);
        appendFullText(sb);
        return sb.toString();
    }

    /**
     * Text without the trailing trivia of the last token.
     */
    public String getText() {
        return toFullString().substring(0, getWidth());
    }

    private void appendFullText(StringBuilder sb) {
        if (isToken()) {
            sb.append(tokenText).append(trailingTrivia);
            return;
        }
        for (SyntaxNode child : children) {
            child.appendFullText(sb);
        }
    }

    // ==================== ANNOTATIONS ====================

    public List<SyntaxAnnotation> getAnnotations() {
        return annotations;
    }

    public List<SyntaxAnnotation> getAnnotations(String annotationKind) {
        return annotations.stream()
                .filter(annotation -> annotation.getKind().equals(annotationKind))
                .collect(Collectors.toList());
    }

    public boolean hasAnnotations(String annotationKind) {
        for (SyntaxAnnotation annotation : annotations) {
            if (annotation.getKind().equals(annotationKind)) {
                return true;
            }
        }
        return false;
    }

    public SyntaxNode withAdditionalAnnotations(SyntaxAnnotation... additional) {
        return withAdditionalAnnotations(Arrays.asList(additional));
    }

    public SyntaxNode withAdditionalAnnotations(Collection<SyntaxAnnotation> additional) {
        if (additional.isEmpty()) {
            return this;
        }
        List<SyntaxAnnotation> merged = new ArrayList<>(annotations);
        merged.addAll(additional);
        return new SyntaxNode(kind, tokenText, trailingTrivia, children, List.copyOf(merged));
    }

    public SyntaxNode withoutAnnotations(String annotationKind) {
        if (!hasAnnotations(annotationKind)) {
            return this;
        }
        List<SyntaxAnnotation> remaining = annotations.stream()
                .filter(annotation -> !annotation.getKind().equals(annotationKind))
                .collect(Collectors.toList());
        return new SyntaxNode(kind, tokenText, trailingTrivia, children, List.copyOf(remaining));
    }

    // ==================== COPY-ON-WRITE ====================

    /**
     * Returns a node with the same kind and annotations but different children.
     */
    public SyntaxNode withChildren(List<SyntaxNode> newChildren) {
        if (isToken()) {
            throw new IllegalStateException("Tokens have no children");
        }
        SyntaxNode rebuilt = node(kind, newChildren);
        return new SyntaxNode(kind, null, null, rebuilt.children, annotations);
    }

    /**
     * Returns a node whose last token carries the given trailing trivia.
     */
    public SyntaxNode withTrailingTrivia(String trivia) {
        if (isToken()) {
            return new SyntaxNode(kind, tokenText, trivia != null ? trivia : "", children, annotations);
        }
        List<SyntaxNode> newChildren = new ArrayList<>(children);
        int last = newChildren.size() - 1;
        newChildren.set(last, newChildren.get(last).withTrailingTrivia(trivia));
        return withChildren(newChildren);
    }

    /**
     * Replaces the given nodes (matched by identity) anywhere in this subtree.
     *
     * <p>Replacement runs bottom-up: {@code computeReplacement} receives the original node and
     * the node rebuilt with its already-replaced descendants. Subtrees containing no
     * replaced node are shared as-is.</p>
     *
     * @param nodes Nodes of this subtree to replace
     * @param computeReplacement (original, rewritten) to replacement
     * @return The new subtree root, or this node if nothing changed
     */
    public SyntaxNode replaceNodes(Collection<SyntaxNode> nodes,
                                   BiFunction<SyntaxNode, SyntaxNode, SyntaxNode> computeReplacement) {
        if (nodes.isEmpty()) {
            return this;
        }
        Set<SyntaxNode> targets = Collections.newSetFromMap(new IdentityHashMap<>());
        targets.addAll(nodes);
        return replace(this, targets, computeReplacement);
    }

    private static SyntaxNode replace(SyntaxNode node, Set<SyntaxNode> targets,
                                      BiFunction<SyntaxNode, SyntaxNode, SyntaxNode> computeReplacement) {
        SyntaxNode rewritten = node;
        if (!node.isToken()) {
            List<SyntaxNode> newChildren = null;
            for (int i = 0; i < node.children.size(); i++) {
                SyntaxNode child = node.children.get(i);
                SyntaxNode newChild = replace(child, targets, computeReplacement);
                if (newChild != child) {
                    if (newChildren == null) {
                        newChildren = new ArrayList<>(node.children);
                    }
                    newChildren.set(i, newChild);
                }
            }
            if (newChildren != null) {
                rewritten = node.withChildren(newChildren);
            }
        }
        if (targets.contains(node)) {
            SyntaxNode replacement = computeReplacement.apply(node, rewritten);
            if (replacement == null) {
                throw new IllegalStateException("Replacement for " + node.kind + " cannot be null");
            }
            return replacement;
        }
        return rewritten;
    }

    // ==================== TRAVERSAL ====================

    /**
     * Pre-order list of the non-token descendants of this node (this node excluded).
     *
     * <p>Pruning descent: the children of a node are only visited when
     * {@code descendIntoChildren} accepts that node. The predicate is also applied to this
     * node, so a rejected start node yields an empty list. A rejected descendant is still
     * part of the result; only its own descendants are skipped.</p>
     */
    public List<SyntaxNode> descendantNodes(Predicate<SyntaxNode> descendIntoChildren) {
        List<SyntaxNode> result = new ArrayList<>();
        if (descendIntoChildren.test(this)) {
            collectDescendants(this, descendIntoChildren, result);
        }
        return result;
    }

    public List<SyntaxNode> descendantNodes() {
        return descendantNodes(node -> true);
    }

    public List<SyntaxNode> descendantNodesAndSelf() {
        List<SyntaxNode> result = new ArrayList<>();
        if (!isToken()) {
            result.add(this);
        }
        result.addAll(descendantNodes());
        return result;
    }

    private static void collectDescendants(SyntaxNode node, Predicate<SyntaxNode> descendIntoChildren,
                                           List<SyntaxNode> result) {
        for (SyntaxNode child : node.children) {
            if (child.isToken()) {
                continue;
            }
            result.add(child);
            if (descendIntoChildren.test(child)) {
                collectDescendants(child, descendIntoChildren, result);
            }
        }
    }

    /**
     * Structural comparison: same kinds, same token text, same shape.
     * Trivia and annotations are ignored.
     */
    public boolean isEquivalentTo(SyntaxNode other) {
        if (other == this) {
            return true;
        }
        if (other == null || other.kind != kind) {
            return false;
        }
        if (isToken()) {
            return tokenText.equals(other.tokenText);
        }
        if (children.size() != other.children.size()) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).isEquivalentTo(other.children.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return kind + "[" + getText() + "]";
    }
}

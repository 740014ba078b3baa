package me.christianrobert.namereduce.syntax.util;

import me.christianrobert.namereduce.syntax.SyntaxKind;
import me.christianrobert.namereduce.syntax.SyntaxNode;
import me.christianrobert.namereduce.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural questions about name nodes that both the semantic oracle and the expansion
 * policies need to answer the same way.
 */
public final class NameSyntax {

    private NameSyntax() {
    }

    /**
     * Segments of a pure dotted name ({@code A}, {@code A.B.C}), outermost first.
     *
     * @return The segments, or null if the node is not a name made only of identifiers
     *         (e.g. {@code Create().Name})
     */
    public static List<String> dottedSegments(SyntaxNode node) {
        if (node == null || !node.getKind().isName()) {
            return null;
        }
        if (node.getKind() == SyntaxKind.IDENTIFIER_NAME) {
            List<String> single = new ArrayList<>();
            single.add(node.getChildren().get(0).getTokenText());
            return single;
        }

        List<SyntaxNode> children = node.getChildren();
        if (children.size() != 3) {
            return null;
        }
        List<String> segments = dottedSegments(children.get(0));
        SyntaxNode right = children.get(2);
        if (segments == null || right.getKind() != SyntaxKind.IDENTIFIER_NAME) {
            return null;
        }
        segments.add(right.getChildren().get(0).getTokenText());
        return segments;
    }

    public static boolean isDottedName(SyntaxNode node) {
        return dottedSegments(node) != null;
    }

    public static String dottedText(List<String> segments) {
        return String.join(".", segments);
    }

    /**
     * Whether the node is the type of a declaration or construction, e.g. {@code List} in
     * {@code new List()} or {@code Dim x As List}.
     */
    public static boolean isTypePosition(SyntaxNode node, SyntaxTree tree) {
        if (!node.getKind().isName()) {
            return false;
        }
        SyntaxNode parent = tree.getParent(node);
        if (parent == null) {
            return false;
        }
        switch (parent.getKind()) {
            case OBJECT_CREATION:
            case LOCAL_DECLARATION:
            case FIELD_DECLARATION:
            case PARAMETER:
                return parent.getFirstNameChild() == node;
            default:
                return false;
        }
    }

    /**
     * Whether the node is the name to the right of the dot in a qualified name or member
     * access, e.g. {@code Color} in {@code GetPen().Color}. Such a name only means something
     * relative to its left side.
     */
    public static boolean isRightOfDot(SyntaxNode node, SyntaxTree tree) {
        SyntaxNode parent = tree.getParent(node);
        if (parent == null) {
            return false;
        }
        if (parent.getKind() != SyntaxKind.MEMBER_ACCESS && parent.getKind() != SyntaxKind.QUALIFIED_NAME) {
            return false;
        }
        List<SyntaxNode> siblings = parent.getChildren();
        return siblings.size() == 3 && siblings.get(2) == node;
    }

    /**
     * Whether the node is (part of) the name of the namespace declaration it belongs to.
     */
    public static boolean isDeclarationName(SyntaxNode node, SyntaxTree tree) {
        SyntaxNode parent = tree.getParent(node);
        while (parent != null && parent.getKind().isName()) {
            parent = tree.getParent(parent);
        }
        return parent != null && parent.getKind() == SyntaxKind.NAMESPACE_DECLARATION;
    }

    /**
     * Whether the node is inside (or is) an import directive.
     */
    public static boolean isInImportDirective(SyntaxNode node, SyntaxTree tree) {
        return node.getKind() == SyntaxKind.IMPORT_DIRECTIVE
                || tree.getFirstAncestor(node, SyntaxKind.IMPORT_DIRECTIVE) != null;
    }
}

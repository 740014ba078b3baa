package me.christianrobert.namereduce.syntax.util;

import me.christianrobert.namereduce.syntax.SyntaxAnnotation;
import me.christianrobert.namereduce.syntax.SyntaxNode;
import me.christianrobert.namereduce.syntax.SyntaxTree;

/**
 * Formats syntax trees into human-readable, indented text.
 *
 * <p>Useful for debugging which nodes were marked, rewritten or annotated.</p>
 *
 * <p>Example output:</p>
 * <pre>
 * COMPILATION_UNIT
 *   IMPORT_DIRECTIVE
 *     "using"
 *     QUALIFIED_NAME [System.Text]
 *       IDENTIFIER_NAME [System]
 *         "System"
 *       "."
 *       IDENTIFIER_NAME [Text]
 *         "Text"
 *     ";"
 *   ...
 * </pre>
 */
public class SyntaxTreeFormatter {

    private static final String INDENT = "  ";
    private static final int MAX_TEXT_LENGTH = 50;

    public static String format(SyntaxTree tree) {
        if (tree == null) {
            return "(null tree)";
        }
        return format(tree.getRoot());
    }

    public static String format(SyntaxNode node) {
        if (node == null) {
            return "(null node)";
        }
        StringBuilder sb = new StringBuilder();
        formatNode(node, 0, sb);
        return sb.toString();
    }

    private static void formatNode(SyntaxNode node, int depth, StringBuilder sb) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }

        if (node.isToken()) {
            sb.append("\"").append(escapeAndTruncate(node.getTokenText())).append("\"");
        } else {
            sb.append(node.getKind());
            // Text snippet for small nodes helps to identify names
            String text = node.getText();
            if (node.getChildren().size() <= 3 && text.length() <= 30) {
                sb.append(" [").append(escapeAndTruncate(text)).append("]");
            }
        }

        for (SyntaxAnnotation annotation : node.getAnnotations()) {
            sb.append(" {").append(annotation.getKind());
            if (annotation.getData() != null) {
                sb.append(": ").append(escapeAndTruncate(annotation.getData()));
            }
            sb.append("}");
        }
        sb.append("\n");

        for (SyntaxNode child : node.getChildren()) {
            formatNode(child, depth + 1, sb);
        }
    }

    private static String escapeAndTruncate(String text) {
        if (text == null) {
            return "";
        }

        text = text.replace("\n", "\\n")
                   .replace("\r", "\\r")
                   .replace("\t", "\\t");

        if (text.length() > MAX_TEXT_LENGTH) {
            text = text.substring(0, MAX_TEXT_LENGTH) + "...";
        }

        return text;
    }
}

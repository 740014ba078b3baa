package me.christianrobert.namereduce.context;

import me.christianrobert.namereduce.syntax.SyntaxNode;
import me.christianrobert.namereduce.syntax.TextSpan;

/**
 * Wraps a failure that happened while rewriting one particular node.
 *
 * <p>{@link #toString()} is the warning text attached to the node: the prefix, the node kind
 * and position, the cause, and the node's source text.</p>
 */
public class NodeConversionException extends ReductionException {

    private static final int MAX_SOURCE_LENGTH = 200;

    private final String prefix;
    private final String nodeKind;
    private final TextSpan span;
    private final String nodeText;

    public NodeConversionException(Throwable cause, SyntaxNode node, TextSpan span, String prefix) {
        super(prefix + ": " + node.getKind() + " at " + span, cause);
        this.prefix = prefix;
        this.nodeKind = node.getKind().name();
        this.span = span;
        this.nodeText = node.getText();
    }

    public String getNodeKind() {
        return nodeKind;
    }

    public TextSpan getSpan() {
        return span;
    }

    public String getNodeText() {
        return nodeText;
    }

    @Override
    public String toString() {
        String source = nodeText.length() > MAX_SOURCE_LENGTH
                ? nodeText.substring(0, MAX_SOURCE_LENGTH) + "..."
                : nodeText;
        return prefix + ": failed to convert " + nodeKind + " at " + span + "\n"
                + getCause() + "\n"
                + "Source: " + source;
    }
}

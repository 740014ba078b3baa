package me.christianrobert.namereduce.context;

import me.christianrobert.namereduce.syntax.SyntaxKind;
import me.christianrobert.namereduce.syntax.TextSpan;

/**
 * A conversion warning found on a tree, with the position of the node it is attached to.
 */
public class ConversionWarning {

    private final SyntaxKind nodeKind;
    private final TextSpan span;
    private final String message;
    private final boolean documentLevel;

    public ConversionWarning(SyntaxKind nodeKind, TextSpan span, String message, boolean documentLevel) {
        this.nodeKind = nodeKind;
        this.span = span;
        this.message = message;
        this.documentLevel = documentLevel;
    }

    public SyntaxKind getNodeKind() {
        return nodeKind;
    }

    public TextSpan getSpan() {
        return span;
    }

    public String getMessage() {
        return message;
    }

    /**
     * True when the warning is attached to the root, i.e. a whole phase failed for the document.
     */
    public boolean isDocumentLevel() {
        return documentLevel;
    }

    @Override
    public String toString() {
        return "ConversionWarning{" + nodeKind + " " + span + (documentLevel ? ", document" : "")
                + ", message='" + message + "'}";
    }
}

package me.christianrobert.namereduce.context;

import me.christianrobert.namereduce.core.tools.FutureUtils;
import me.christianrobert.namereduce.syntax.SyntaxAnnotation;
import me.christianrobert.namereduce.syntax.SyntaxNode;
import me.christianrobert.namereduce.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Attaches and reads conversion-warning annotations.
 *
 * <p>Warnings are part of the produced tree rather than a side log, so callers see a failure
 * exactly where it happened.</p>
 */
public final class WarningAnnotations {

    public static final String WARNING_PREFIX = "Conversion warning";
    public static final String DOCUMENT_FAILURE_TEXT =
            WARNING_PREFIX + ": Qualified name reduction failed for this file. ";

    private WarningAnnotations() {
    }

    public static SyntaxNode withWarning(SyntaxNode node, String warningText) {
        return node.withAdditionalAnnotations(SyntaxAnnotation.conversionWarning(warningText));
    }

    /**
     * Returns the given snapshot with one document-level warning on its root.
     */
    public static SyntaxTree withDocumentWarning(SyntaxTree tree, Throwable error) {
        Throwable cause = FutureUtils.unwrap(error);
        return tree.withRoot(withWarning(tree.getRoot(), DOCUMENT_FAILURE_TEXT + cause));
    }

    public static int countWarnings(SyntaxNode node) {
        return node.getAnnotations(SyntaxAnnotation.CONVERSION_WARNING_KIND).size();
    }

    /**
     * Collects all warnings of a tree in document order.
     */
    public static List<ConversionWarning> collect(SyntaxTree tree) {
        List<ConversionWarning> warnings = new ArrayList<>();
        for (SyntaxNode node : tree.getRoot().descendantNodesAndSelf()) {
            for (SyntaxAnnotation annotation : node.getAnnotations(SyntaxAnnotation.CONVERSION_WARNING_KIND)) {
                warnings.add(new ConversionWarning(node.getKind(), tree.getSpan(node), annotation.getData(),
                        node == tree.getRoot()));
            }
        }
        return warnings;
    }
}

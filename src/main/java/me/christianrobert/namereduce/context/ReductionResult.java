package me.christianrobert.namereduce.context;

import me.christianrobert.namereduce.syntax.SyntaxTree;

import java.util.Collections;
import java.util.List;

/**
 * Result of running expansion and simplification on one document.
 *
 * <p>A successful result always carries a tree, even when a phase failed: such failures are
 * recorded as conversion warnings in the tree and flagged here. A failed result means the
 * pipeline could not run at all (e.g. no tree was given).</p>
 */
public class ReductionResult {

    private final boolean success;
    private final String documentName;
    private final SyntaxTree originalTree;
    private final SyntaxTree reducedTree;
    private final String errorMessage;
    private final List<ConversionWarning> warnings;
    private final boolean expandFailed;
    private final boolean simplifyFailed;
    private final String treeDump;  // Optional formatted tree (null by default)

    private ReductionResult(boolean success, String documentName, SyntaxTree originalTree, SyntaxTree reducedTree,
                            String errorMessage, boolean expandFailed, boolean simplifyFailed, String treeDump) {
        this.success = success;
        this.documentName = documentName;
        this.originalTree = originalTree;
        this.reducedTree = reducedTree;
        this.errorMessage = errorMessage;
        this.warnings = reducedTree != null
                ? Collections.unmodifiableList(WarningAnnotations.collect(reducedTree))
                : Collections.emptyList();
        this.expandFailed = expandFailed;
        this.simplifyFailed = simplifyFailed;
        this.treeDump = treeDump;
    }

    /**
     * Creates a result for a document the pipeline ran on.
     */
    public static ReductionResult success(SyntaxTree originalTree, SyntaxTree reducedTree,
                                          boolean expandFailed, boolean simplifyFailed) {
        return new ReductionResult(true, originalTree.getDocumentName(), originalTree, reducedTree, null,
                expandFailed, simplifyFailed, null);
    }

    /**
     * Creates a result for a document the pipeline ran on, with the formatted reduced tree.
     */
    public static ReductionResult successWithTreeDump(SyntaxTree originalTree, SyntaxTree reducedTree,
                                                      boolean expandFailed, boolean simplifyFailed, String treeDump) {
        return new ReductionResult(true, originalTree.getDocumentName(), originalTree, reducedTree, null,
                expandFailed, simplifyFailed, treeDump);
    }

    /**
     * Creates a failed result.
     */
    public static ReductionResult failure(String documentName, String errorMessage) {
        return new ReductionResult(false, documentName, null, null, errorMessage, false, false, null);
    }

    /**
     * Creates a failed result from an exception.
     */
    public static ReductionResult failure(String documentName, ReductionException exception) {
        return new ReductionResult(false, documentName, null, null, exception.getDetailedMessage(),
                false, false, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getDocumentName() {
        return documentName;
    }

    public SyntaxTree getOriginalTree() {
        return originalTree;
    }

    public SyntaxTree getReducedTree() {
        return reducedTree;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public List<ConversionWarning> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean isExpandFailed() {
        return expandFailed;
    }

    public boolean isSimplifyFailed() {
        return simplifyFailed;
    }

    public String getTreeDump() {
        return treeDump;
    }

    public boolean hasTreeDump() {
        return treeDump != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "ReductionResult{success=true, document='" + documentName + "', warnings=" + warnings.size()
                    + (expandFailed ? ", expandFailed=true" : "")
                    + (simplifyFailed ? ", simplifyFailed=true" : "") + "}";
        } else {
            return "ReductionResult{success=false, document='" + documentName + "', error='" + errorMessage + "'}";
        }
    }
}

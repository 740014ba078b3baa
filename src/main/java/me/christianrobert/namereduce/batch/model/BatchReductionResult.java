package me.christianrobert.namereduce.batch.model;

import me.christianrobert.namereduce.context.ReductionResult;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of reducing a batch of documents, in submission order.
 */
public class BatchReductionResult {

    private final List<ReductionResult> results;

    public BatchReductionResult(List<ReductionResult> results) {
        this.results = Collections.unmodifiableList(results);
    }

    public List<ReductionResult> getResults() {
        return results;
    }

    /**
     * Result for a document, or null if the batch has no document of that name.
     */
    public ReductionResult getResult(String documentName) {
        for (ReductionResult result : results) {
            if (documentName != null && documentName.equals(result.getDocumentName())) {
                return result;
            }
        }
        return null;
    }

    public int getDocumentCount() {
        return results.size();
    }

    public int getSuccessCount() {
        return (int) results.stream().filter(ReductionResult::isSuccess).count();
    }

    public int getFailureCount() {
        return results.size() - getSuccessCount();
    }

    public int getExpandFailureCount() {
        return (int) results.stream().filter(ReductionResult::isExpandFailed).count();
    }

    public int getSimplifyFailureCount() {
        return (int) results.stream().filter(ReductionResult::isSimplifyFailed).count();
    }

    public int getWarningCount() {
        return results.stream().mapToInt(result -> result.getWarnings().size()).sum();
    }

    @Override
    public String toString() {
        return "BatchReductionResult{documents=" + getDocumentCount()
                + ", failed=" + getFailureCount()
                + ", expandFailures=" + getExpandFailureCount()
                + ", simplifyFailures=" + getSimplifyFailureCount()
                + ", warnings=" + getWarningCount() + "}";
    }
}

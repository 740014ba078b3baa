package me.christianrobert.namereduce.batch.job;

import me.christianrobert.namereduce.batch.model.BatchReductionResult;
import me.christianrobert.namereduce.config.service.ConfigService;
import me.christianrobert.namereduce.context.ReductionException;
import me.christianrobert.namereduce.context.ReductionResult;
import me.christianrobert.namereduce.core.job.Job;
import me.christianrobert.namereduce.core.job.exception.JobCancelledException;
import me.christianrobert.namereduce.core.job.model.JobProgress;
import me.christianrobert.namereduce.semantic.SemanticOracle;
import me.christianrobert.namereduce.service.NameReductionService;
import me.christianrobert.namereduce.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Reduces the qualified names of a batch of translated documents, one after the other.
 *
 * <p>A document-level failure only affects that document's result. The job checks for
 * cancellation before each document; documents already reduced are discarded with the
 * cancelled job.</p>
 */
public class DocumentBatchReductionJob implements Job<BatchReductionResult> {

    private static final Logger log = LoggerFactory.getLogger(DocumentBatchReductionJob.class);

    private static final int DEFAULT_MAX_DOCUMENTS = 1000;

    private final String jobId;
    private final NameReductionService reductionService;
    private final ConfigService configService;
    private final SemanticOracle oracle;
    private final List<SyntaxTree> documents;
    private final AtomicBoolean cancellationRequested = new AtomicBoolean(false);

    public DocumentBatchReductionJob(NameReductionService reductionService, ConfigService configService,
                                     SemanticOracle oracle, List<SyntaxTree> documents) {
        if (reductionService == null || oracle == null || documents == null) {
            throw new IllegalArgumentException("Reduction service, semantic oracle and documents are required");
        }
        this.jobId = "name-reduction-" + UUID.randomUUID();
        this.reductionService = reductionService;
        this.configService = configService;
        this.oracle = oracle;
        this.documents = List.copyOf(documents);
    }

    @Override
    public String getJobId() {
        return jobId;
    }

    @Override
    public String getJobType() {
        return "NAME_REDUCTION_BATCH";
    }

    @Override
    public String getDescription() {
        return "Expand and simplify qualified names in " + documents.size() + " documents";
    }

    @Override
    public void requestCancellation() {
        cancellationRequested.set(true);
    }

    @Override
    public CompletableFuture<BatchReductionResult> execute(Consumer<JobProgress> progressCallback) {
        int maxDocuments = getMaxDocuments();
        if (documents.size() > maxDocuments) {
            return CompletableFuture.failedFuture(new ReductionException(
                    "Batch of " + documents.size() + " documents exceeds the limit of " + maxDocuments,
                    null, ConfigService.BATCH_MAX_DOCUMENTS));
        }

        int total = documents.size();
        log.info("Reducing qualified names in {} documents", total);
        updateProgress(progressCallback, 0, "Reducing qualified names", total + " documents");

        List<ReductionResult> results = new ArrayList<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (SyntaxTree document : documents) {
            chain = chain
                    .thenCompose(previous -> {
                        checkCancellation();
                        return reductionService.reduce(document, oracle);
                    })
                    .thenAccept(result -> {
                        results.add(result);
                        int done = results.size();
                        updateProgress(progressCallback, JobProgress.percentageOf(done, total),
                                "Reduced " + document.getDocumentName(), done + "/" + total + " documents");
                    });
        }

        return chain.thenApply(done -> {
            BatchReductionResult batchResult = new BatchReductionResult(results);
            log.info("Name reduction batch finished: {}", batchResult);
            updateProgress(progressCallback, 100, "Name reduction completed", batchResult.toString());
            return batchResult;
        });
    }

    private void checkCancellation() {
        if (cancellationRequested.get()) {
            throw new JobCancelledException("Name reduction batch " + jobId + " was cancelled");
        }
    }

    private int getMaxDocuments() {
        Integer configured = configService != null
                ? configService.getConfigValueAsInteger(ConfigService.BATCH_MAX_DOCUMENTS)
                : null;
        return configured != null && configured > 0 ? configured : DEFAULT_MAX_DOCUMENTS;
    }
}

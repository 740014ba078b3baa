package me.christianrobert.namereduce.core.job;

import me.christianrobert.namereduce.core.job.model.JobProgress;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Long-running unit of work submitted to the
 * {@link me.christianrobert.namereduce.core.job.service.JobService}.
 *
 * @param <T> Result type of the job
 */
public interface Job<T> {

    String getJobId();

    String getJobType();

    String getDescription();

    /**
     * Starts the work.
     *
     * @param progressCallback Receives progress updates, may be null
     * @return Future completing with the job's result
     */
    CompletableFuture<T> execute(Consumer<JobProgress> progressCallback);

    /**
     * Requests cooperative cancellation. Jobs that support it stop at their next checkpoint
     * with a {@link me.christianrobert.namereduce.core.job.exception.JobCancelledException}.
     */
    default void requestCancellation() {
    }

    default void updateProgress(Consumer<JobProgress> progressCallback, int percentage, String currentTask) {
        if (progressCallback != null) {
            progressCallback.accept(new JobProgress(percentage, currentTask));
        }
    }

    default void updateProgress(Consumer<JobProgress> progressCallback, int percentage, String currentTask, String details) {
        if (progressCallback != null) {
            progressCallback.accept(new JobProgress(percentage, currentTask, details));
        }
    }
}

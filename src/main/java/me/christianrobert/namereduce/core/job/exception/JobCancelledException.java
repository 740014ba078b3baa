package me.christianrobert.namereduce.core.job.exception;

/**
 * Thrown by a job that noticed a cancellation request and stops early.
 *
 * <p>Not an error: the {@link me.christianrobert.namereduce.core.job.service.JobService}
 * records the job as CANCELLED rather than FAILED.</p>
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException(String message) {
        super(message);
    }
}

package me.christianrobert.namereduce.core.job.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.namereduce.core.job.Job;
import me.christianrobert.namereduce.core.job.exception.JobCancelledException;
import me.christianrobert.namereduce.core.job.model.JobProgress;
import me.christianrobert.namereduce.core.job.model.JobStatus;
import me.christianrobert.namereduce.core.tools.FutureUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs jobs on one shared thread pool and keeps their status, progress and outcome.
 */
@ApplicationScoped
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final Map<String, JobExecution<?>> jobExecutions = new ConcurrentHashMap<>();

    private ExecutorService executorService;

    @PostConstruct
    public void init() {
        log.info("Initializing shared ExecutorService for job execution");
        executorService = Executors.newCachedThreadPool();
    }

    /**
     * Waits up to 30 seconds for running jobs before forcing the pool down.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down ExecutorService");
        shutdownExecutorService(executorService, 30);
    }

    private void shutdownExecutorService(ExecutorService executor, int timeoutSeconds) {
        if (executor == null || executor.isShutdown()) {
            return;
        }

        try {
            executor.shutdown();
            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Executor did not terminate in {}s, forcing shutdown", timeoutSeconds);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while shutting down executor service", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static class JobExecution<T> {
        private final Job<T> job;
        private volatile JobStatus status;
        private volatile JobProgress progress;
        private volatile LocalDateTime startTime;
        private volatile LocalDateTime endTime;
        private volatile T result;
        private volatile Exception error;
        private volatile CompletableFuture<T> future;

        public JobExecution(Job<T> job) {
            this.job = job;
            this.status = JobStatus.PENDING;
            this.progress = new JobProgress();
        }

        public Job<T> getJob() { return job; }
        public JobStatus getStatus() { return status; }
        public void setStatus(JobStatus status) { this.status = status; }
        public JobProgress getProgress() { return progress; }
        public void setProgress(JobProgress progress) { this.progress = progress; }
        public LocalDateTime getStartTime() { return startTime; }
        public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }
        public LocalDateTime getEndTime() { return endTime; }
        public void setEndTime(LocalDateTime endTime) { this.endTime = endTime; }
        public T getResult() { return result; }
        public void setResult(T result) { this.result = result; }
        public Exception getError() { return error; }
        public void setError(Exception error) { this.error = error; }
        public CompletableFuture<T> getFuture() { return future; }
        public void setFuture(CompletableFuture<T> future) { this.future = future; }
    }

    /**
     * Submits a job for asynchronous execution.
     *
     * @return The job id, used to query status, progress and result
     */
    public <T> String submitJob(Job<T> job) {
        if (executorService == null) {
            throw new IllegalStateException("JobService is not initialized");
        }
        String jobId = job.getJobId();
        log.info("Submitting job: {} ({})", jobId, job.getJobType());

        JobExecution<T> execution = new JobExecution<>(job);
        jobExecutions.put(jobId, execution);

        CompletableFuture<T> future = CompletableFuture
                .supplyAsync(() -> {
                    execution.setStatus(JobStatus.RUNNING);
                    execution.setStartTime(LocalDateTime.now());
                    log.info("Starting job execution: {}", jobId);
                    return FutureUtils.call(() -> job.execute(progress -> {
                        execution.setProgress(progress);
                        log.debug("Job {} progress: {}%", jobId, progress.getPercentage());
                    }));
                }, executorService)
                .thenCompose(running -> running)
                .whenComplete((result, error) -> finish(execution, result, error));

        execution.setFuture(future);
        return jobId;
    }

    private <T> void finish(JobExecution<T> execution, T result, Throwable error) {
        String jobId = execution.getJob().getJobId();
        execution.setEndTime(LocalDateTime.now());
        if (error == null) {
            execution.setResult(result);
            execution.setStatus(JobStatus.COMPLETED);
            log.info("Job completed successfully: {}", jobId);
            return;
        }

        Throwable cause = FutureUtils.unwrap(error);
        execution.setError(cause instanceof Exception ? (Exception) cause : new RuntimeException(cause));
        if (cause instanceof JobCancelledException) {
            execution.setStatus(JobStatus.CANCELLED);
            log.info("Job cancelled: {} ({})", jobId, cause.getMessage());
        } else {
            execution.setStatus(JobStatus.FAILED);
            log.error("Job failed: " + jobId, cause);
        }
    }

    public JobExecution<?> getJobExecution(String jobId) {
        return jobExecutions.get(jobId);
    }

    public JobStatus getJobStatus(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        return execution != null ? execution.getStatus() : null;
    }

    public JobProgress getJobProgress(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        return execution != null ? execution.getProgress() : null;
    }

    public <T> T getJobResult(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        if (execution != null && execution.getStatus() == JobStatus.COMPLETED) {
            @SuppressWarnings("unchecked")
            T result = (T) execution.getResult();
            return result;
        }
        return null;
    }

    public Exception getJobError(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        if (execution != null && execution.getStatus() == JobStatus.FAILED) {
            return execution.getError();
        }
        return null;
    }

    public boolean isJobComplete(String jobId) {
        JobStatus status = getJobStatus(jobId);
        return status == JobStatus.COMPLETED || status == JobStatus.FAILED || status == JobStatus.CANCELLED;
    }

    /**
     * Asks a job to stop at its next checkpoint.
     *
     * @return false if the job is unknown or already complete
     */
    public boolean cancelJob(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        if (execution == null || isJobComplete(jobId)) {
            return false;
        }
        log.info("Requesting cancellation of job: {}", jobId);
        execution.getJob().requestCancellation();
        return true;
    }

    public Map<String, JobExecution<?>> getAllJobExecutions() {
        return Map.copyOf(jobExecutions);
    }

    /**
     * Cancels running jobs, forgets all executions and replaces the thread pool.
     */
    public void resetJobs() {
        log.info("Clearing {} job executions and resetting thread pool", jobExecutions.size());

        for (JobExecution<?> execution : jobExecutions.values()) {
            if (execution.getStatus() == JobStatus.RUNNING) {
                execution.getJob().requestCancellation();
            }
        }
        shutdownExecutorService(executorService, 30);
        jobExecutions.clear();
        executorService = Executors.newCachedThreadPool();
    }
}

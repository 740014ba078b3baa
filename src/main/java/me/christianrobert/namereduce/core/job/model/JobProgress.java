package me.christianrobert.namereduce.core.job.model;

import java.time.LocalDateTime;

/**
 * Snapshot of a job's progress. Percentages are clamped to 0..100.
 */
public class JobProgress {
    private int percentage;
    private String currentTask;
    private String details;
    private LocalDateTime lastUpdated;

    public JobProgress() {
        this.percentage = 0;
        this.currentTask = "";
        this.details = "";
        this.lastUpdated = LocalDateTime.now();
    }

    public JobProgress(int percentage, String currentTask) {
        this();
        this.percentage = clamp(percentage);
        this.currentTask = currentTask != null ? currentTask : "";
    }

    public JobProgress(int percentage, String currentTask, String details) {
        this(percentage, currentTask);
        this.details = details != null ? details : "";
    }

    /**
     * Progress after {@code done} of {@code total} items. An empty batch counts as complete.
     */
    public static int percentageOf(int done, int total) {
        if (total <= 0) {
            return 100;
        }
        return clamp((int) ((long) done * 100 / total));
    }

    private static int clamp(int percentage) {
        return Math.max(0, Math.min(100, percentage));
    }

    public int getPercentage() {
        return percentage;
    }

    public String getCurrentTask() {
        return currentTask;
    }

    public String getDetails() {
        return details;
    }

    public LocalDateTime getLastUpdated() {
        return lastUpdated;
    }

    @Override
    public String toString() {
        return "JobProgress{" +
                "percentage=" + percentage +
                ", currentTask='" + currentTask + '\'' +
                ", details='" + details + '\'' +
                ", lastUpdated=" + lastUpdated +
                '}';
    }
}

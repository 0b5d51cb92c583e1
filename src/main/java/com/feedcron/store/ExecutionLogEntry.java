package com.feedcron.store;

import java.time.Duration;
import java.time.Instant;

/**
 * One append-only record of a completed job firing.
 */
public final class ExecutionLogEntry {
    private final String jobKey;
    private final String jobGroup;
    private final Instant startTime;
    private final Instant endTime;
    private final Duration duration;
    private final ExecutionStatus status;
    private final String errorMessage;
    private final String stackTrace;
    private final int itemsProcessed;

    public ExecutionLogEntry(String jobKey, String jobGroup, Instant startTime, Instant endTime,
                             ExecutionStatus status, String errorMessage, String stackTrace,
                             int itemsProcessed) {
        if (jobKey == null || jobGroup == null || startTime == null || endTime == null || status == null) {
            throw new IllegalArgumentException("jobKey, jobGroup, startTime, endTime and status are required");
        }
        this.jobKey = jobKey;
        this.jobGroup = jobGroup;
        this.startTime = startTime;
        this.endTime = endTime;
        this.duration = Duration.between(startTime, endTime);
        this.status = status;
        this.errorMessage = errorMessage;
        this.stackTrace = stackTrace;
        this.itemsProcessed = itemsProcessed;
    }

    public String getJobKey() { return jobKey; }
    public String getJobGroup() { return jobGroup; }
    public Instant getStartTime() { return startTime; }
    public Instant getEndTime() { return endTime; }
    public Duration getDuration() { return duration; }
    public ExecutionStatus getStatus() { return status; }
    public String getErrorMessage() { return errorMessage; }
    public String getStackTrace() { return stackTrace; }
    public int getItemsProcessed() { return itemsProcessed; }

    @Override
    public String toString() {
        return "ExecutionLogEntry{" + jobGroup + "." + jobKey + ", status=" + status
                + ", start=" + startTime + ", duration=" + duration.toMillis() + "ms"
                + ", items=" + itemsProcessed + "}";
    }
}

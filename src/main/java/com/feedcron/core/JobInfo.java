package com.feedcron.core;

import com.feedcron.store.ExecutionStatus;

import java.time.Instant;

/**
 * Admin view of one job: live engine state merged with its persisted execution summary.
 * The next execution time always comes from the live trigger.
 */
public final class JobInfo {
    private final String jobKey;
    private final String jobGroup;
    private final String jobType;
    private final String description;
    private final String cronExpression;
    private final Instant lastExecutionTime;
    private final Instant nextExecutionTime;
    private final ExecutionStatus lastStatus;
    private final boolean paused;

    public JobInfo(String jobKey, String jobGroup, String jobType, String description, String cronExpression,
                   Instant lastExecutionTime, Instant nextExecutionTime, ExecutionStatus lastStatus,
                   boolean paused) {
        this.jobKey = jobKey;
        this.jobGroup = jobGroup;
        this.jobType = jobType;
        this.description = description;
        this.cronExpression = cronExpression;
        this.lastExecutionTime = lastExecutionTime;
        this.nextExecutionTime = nextExecutionTime;
        this.lastStatus = lastStatus;
        this.paused = paused;
    }

    public String getJobKey() { return jobKey; }
    public String getJobGroup() { return jobGroup; }
    public String getJobType() { return jobType; }
    public String getDescription() { return description; }
    /** Null when the job has no recurring trigger. */
    public String getCronExpression() { return cronExpression; }
    public Instant getLastExecutionTime() { return lastExecutionTime; }
    public Instant getNextExecutionTime() { return nextExecutionTime; }
    public ExecutionStatus getLastStatus() { return lastStatus; }
    public boolean isPaused() { return paused; }

    @Override
    public String toString() {
        return "JobInfo{" + jobGroup + "." + jobKey + ", type=" + jobType + ", cron=" + cronExpression
                + ", next=" + nextExecutionTime + ", last=" + lastExecutionTime + " " + lastStatus
                + (paused ? ", paused" : "") + "}";
    }
}

package com.feedcron.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Durable record of one scheduled job. The live engine registration is always
 * rebuilt from this record at startup; a job store holds at most one definition
 * per (jobKey, jobGroup).
 */
public final class JobDefinition {
    private final String id;
    private final String jobKey;
    private final String jobGroup;
    private final String jobType;
    private final String cronExpression;
    private final MisfirePolicy misfirePolicy;
    private final boolean paused;
    private final Map<String, String> jobData;
    private final Instant createdAt;
    private final Instant lastExecutionTime;
    private final ExecutionStatus lastStatus;

    private JobDefinition(Builder b) {
        this.id = b.id;
        this.jobKey = requireText(b.jobKey, "jobKey");
        this.jobGroup = requireText(b.jobGroup, "jobGroup");
        this.jobType = requireText(b.jobType, "jobType");
        this.cronExpression = requireText(b.cronExpression, "cronExpression");
        this.misfirePolicy = b.misfirePolicy == null ? MisfirePolicy.FIRE_NOW : b.misfirePolicy;
        this.paused = b.paused;
        this.jobData = Collections.unmodifiableMap(new LinkedHashMap<>(b.jobData));
        this.createdAt = b.createdAt;
        this.lastExecutionTime = b.lastExecutionTime;
        this.lastStatus = b.lastStatus;
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with this definition's values. */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .jobKey(jobKey)
                .jobGroup(jobGroup)
                .jobType(jobType)
                .cronExpression(cronExpression)
                .misfirePolicy(misfirePolicy)
                .paused(paused)
                .jobData(jobData)
                .createdAt(createdAt)
                .lastExecutionTime(lastExecutionTime)
                .lastStatus(lastStatus);
    }

    /** Store-assigned identity; null until the definition has been persisted. */
    public String getId() { return id; }
    public String getJobKey() { return jobKey; }
    public String getJobGroup() { return jobGroup; }
    public String getJobType() { return jobType; }
    public String getCronExpression() { return cronExpression; }
    public MisfirePolicy getMisfirePolicy() { return misfirePolicy; }
    public boolean isPaused() { return paused; }
    public Map<String, String> getJobData() { return jobData; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastExecutionTime() { return lastExecutionTime; }
    public ExecutionStatus getLastStatus() { return lastStatus; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobDefinition other)) return false;
        return paused == other.paused
                && Objects.equals(id, other.id)
                && jobKey.equals(other.jobKey)
                && jobGroup.equals(other.jobGroup)
                && jobType.equals(other.jobType)
                && cronExpression.equals(other.cronExpression)
                && misfirePolicy == other.misfirePolicy
                && jobData.equals(other.jobData)
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(lastExecutionTime, other.lastExecutionTime)
                && lastStatus == other.lastStatus;
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobKey, jobGroup);
    }

    @Override
    public String toString() {
        return "JobDefinition{" + jobGroup + "." + jobKey + ", type=" + jobType
                + ", cron='" + cronExpression + "', misfire=" + misfirePolicy
                + ", paused=" + paused + "}";
    }

    public static final class Builder {
        private String id;
        private String jobKey;
        private String jobGroup;
        private String jobType;
        private String cronExpression;
        private MisfirePolicy misfirePolicy;
        private boolean paused;
        private final Map<String, String> jobData = new LinkedHashMap<>();
        private Instant createdAt;
        private Instant lastExecutionTime;
        private ExecutionStatus lastStatus;

        private Builder() {}

        public Builder id(String id) { this.id = id; return this; }
        public Builder jobKey(String jobKey) { this.jobKey = jobKey; return this; }
        public Builder jobGroup(String jobGroup) { this.jobGroup = jobGroup; return this; }
        public Builder jobType(String jobType) { this.jobType = jobType; return this; }
        public Builder cronExpression(String cron) { this.cronExpression = cron; return this; }
        public Builder misfirePolicy(MisfirePolicy policy) { this.misfirePolicy = policy; return this; }
        public Builder paused(boolean paused) { this.paused = paused; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder lastExecutionTime(Instant t) { this.lastExecutionTime = t; return this; }
        public Builder lastStatus(ExecutionStatus status) { this.lastStatus = status; return this; }

        /** Replaces the job data with a copy of the given map. */
        public Builder jobData(Map<String, String> data) {
            this.jobData.clear();
            if (data != null) {
                this.jobData.putAll(data);
            }
            return this;
        }

        public Builder putJobData(String key, String value) {
            this.jobData.put(key, value);
            return this;
        }

        public JobDefinition build() {
            return new JobDefinition(this);
        }
    }
}

package com.feedcron.jobs;

import org.quartz.Job;

/**
 * The kinds of recurring work the scheduler knows how to run. The type name is
 * what gets persisted with a job definition and resolved again on restore.
 */
public enum JobType {
    INGESTION("IngestionJob", IngestionJob.class),
    CLEANUP("CleanupJob", CleanupJob.class),
    ANALYTICS("AnalyticsJob", AnalyticsJob.class),
    SMART_TAGGING("SmartTaggingJob", SmartTaggingJob.class);

    private final String typeName;
    private final Class<? extends WorkExecutorJob> jobClass;

    JobType(String typeName, Class<? extends WorkExecutorJob> jobClass) {
        this.typeName = typeName;
        this.jobClass = jobClass;
    }

    public String getTypeName() {
        return typeName;
    }

    public Class<? extends WorkExecutorJob> getJobClass() {
        return jobClass;
    }

    /** Creates the Quartz job instance for this type, bound to its executor. */
    public WorkExecutorJob newJob(WorkExecutor executor) {
        switch (this) {
            case INGESTION:
                return new IngestionJob(executor);
            case CLEANUP:
                return new CleanupJob(executor);
            case ANALYTICS:
                return new AnalyticsJob(executor);
            case SMART_TAGGING:
                return new SmartTaggingJob(executor);
            default:
                throw new IllegalStateException("Unhandled job type " + this);
        }
    }

    /** Resolves a persisted type name; null when no type carries that name. */
    public static JobType fromName(String typeName) {
        for (JobType t : values()) {
            if (t.typeName.equals(typeName)) {
                return t;
            }
        }
        return null;
    }

    /** Resolves the type owning a Quartz job class; null for foreign job classes. */
    public static JobType forJobClass(Class<? extends Job> jobClass) {
        for (JobType t : values()) {
            if (t.jobClass.equals(jobClass)) {
                return t;
            }
        }
        return null;
    }
}

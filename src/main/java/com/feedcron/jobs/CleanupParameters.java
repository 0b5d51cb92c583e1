package com.feedcron.jobs;

import java.util.Map;

public final class CleanupParameters extends JobParameters {
    public static final String RETENTION_DAYS_KEY = "RetentionDays";

    private final int retentionDays;

    public CleanupParameters(int retentionDays) {
        this.retentionDays = retentionDays;
    }

    @Override
    public JobType getJobType() {
        return JobType.CLEANUP;
    }

    @Override
    protected void writeTo(Map<String, String> data) {
        data.put(RETENTION_DAYS_KEY, String.valueOf(retentionDays));
    }

    public int getRetentionDays() {
        return retentionDays;
    }
}

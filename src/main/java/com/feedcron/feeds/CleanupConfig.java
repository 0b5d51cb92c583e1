package com.feedcron.feeds;

/**
 * Retention policy for the cleanup job.
 */
public final class CleanupConfig {
    public static final int DEFAULT_RETENTION_DAYS = 30;

    private final int retentionDays;

    public CleanupConfig(int retentionDays) {
        this.retentionDays = retentionDays > 0 ? retentionDays : DEFAULT_RETENTION_DAYS;
    }

    public int getRetentionDays() {
        return retentionDays;
    }
}

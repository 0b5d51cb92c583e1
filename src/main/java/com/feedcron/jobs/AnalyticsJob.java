package com.feedcron.jobs;

import com.feedcron.core.DisallowConcurrentExecution;
import org.quartz.PersistJobDataAfterExecution;

/**
 * Aggregates daily ingestion and verification metrics.
 */
@DisallowConcurrentExecution
@PersistJobDataAfterExecution
public class AnalyticsJob extends WorkExecutorJob {
    public AnalyticsJob(WorkExecutor executor) {
        super(executor);
    }
}

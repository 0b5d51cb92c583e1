package com.feedcron.jobs;

import com.feedcron.core.DisallowConcurrentExecution;
import org.quartz.PersistJobDataAfterExecution;

/**
 * Fetches one feed and stores its new articles.
 */
@DisallowConcurrentExecution
@PersistJobDataAfterExecution
public class IngestionJob extends WorkExecutorJob {
    public IngestionJob(WorkExecutor executor) {
        super(executor);
    }
}

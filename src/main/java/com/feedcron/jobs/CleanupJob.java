package com.feedcron.jobs;

import com.feedcron.core.DisallowConcurrentExecution;
import org.quartz.PersistJobDataAfterExecution;

/**
 * Removes articles older than the retention period.
 */
@DisallowConcurrentExecution
@PersistJobDataAfterExecution
public class CleanupJob extends WorkExecutorJob {
    public CleanupJob(WorkExecutor executor) {
        super(executor);
    }
}

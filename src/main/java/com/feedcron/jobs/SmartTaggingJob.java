package com.feedcron.jobs;

import com.feedcron.core.DisallowConcurrentExecution;
import org.quartz.PersistJobDataAfterExecution;

/**
 * Tags untagged articles in batches.
 */
@DisallowConcurrentExecution
@PersistJobDataAfterExecution
public class SmartTaggingJob extends WorkExecutorJob {
    public SmartTaggingJob(WorkExecutor executor) {
        super(executor);
    }
}

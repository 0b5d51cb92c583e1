package com.feedcron.jobs;

import org.quartz.InterruptableJob;
import org.quartz.JobDataMap;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Quartz job that hands a firing to its {@link WorkExecutor}. Any exception the
 * executor throws becomes a {@link JobExecutionException} so that listeners see
 * the failure and the scheduler keeps running.
 */
public abstract class WorkExecutorJob implements InterruptableJob {
    /** Context key holding the number of items the executor processed. */
    public static final String ITEMS_PROCESSED = "ItemsProcessed";
    /** Context key set when the run stopped because cancellation was requested. */
    public static final String CANCELLED = "Cancelled";

    private static final Logger log = LoggerFactory.getLogger(WorkExecutorJob.class);

    private final WorkExecutor executor;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    protected WorkExecutorJob(WorkExecutor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("WorkExecutor required");
        }
        this.executor = executor;
    }

    @Override
    public void execute(JobExecutionContext context) throws JobExecutionException {
        WorkContext work = new WorkContext(
                context.getJobDetail().getKey().getName(),
                context.getJobDetail().getKey().getGroup(),
                toStringMap(context.getMergedJobDataMap()),
                cancelled);
        try {
            executor.execute(work);
        } catch (JobExecutionException e) {
            throw e;
        } catch (Exception e) {
            throw new JobExecutionException(getClass().getSimpleName() + " failed: " + e.getMessage(), e);
        } finally {
            context.put(ITEMS_PROCESSED, work.getItemsProcessed());
            if (cancelled.get()) {
                context.put(CANCELLED, Boolean.TRUE);
            }
        }
    }

    @Override
    public void interrupt() {
        log.info("Cancellation requested for {}", getClass().getSimpleName());
        cancelled.set(true);
    }

    private static Map<String, String> toStringMap(JobDataMap map) {
        Map<String, String> data = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : map.entrySet()) {
            data.put(e.getKey(), e.getValue() == null ? null : String.valueOf(e.getValue()));
        }
        return data;
    }
}

package com.feedcron.core;

import com.feedcron.jobs.WorkExecutorJob;
import com.feedcron.store.ExecutionLogEntry;
import com.feedcron.store.ExecutionStatus;
import com.feedcron.store.JobStore;
import com.feedcron.store.JobStoreException;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.JobKey;
import org.quartz.JobListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Writes one execution log entry per completed run and keeps the persisted
 * definition's last execution summary current. Store failures are logged and
 * never reach the engine.
 */
public class ExecutionLogListener implements JobListener {
    private static final Logger log = LoggerFactory.getLogger(ExecutionLogListener.class);

    static final String START_TIME = "StartTime";

    private final JobStore store;
    private final Clock clock;

    public ExecutionLogListener(JobStore store) {
        this(store, Clock.systemUTC());
    }

    public ExecutionLogListener(JobStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "ExecutionLogListener";
    }

    @Override
    public void jobToBeExecuted(JobExecutionContext context) {
        context.put(START_TIME, clock.instant());
        log.debug("Starting job {}", context.getJobDetail().getKey());
    }

    @Override
    public void jobExecutionVetoed(JobExecutionContext context) {
        log.warn("Firing of job {} was vetoed", context.getJobDetail().getKey());
        Metrics.getInstance().recordVetoed();
    }

    @Override
    public void jobWasExecuted(JobExecutionContext context, JobExecutionException jobException) {
        JobKey key = context.getJobDetail().getKey();
        Instant end = clock.instant();
        Object started = context.get(START_TIME);
        Instant start = started instanceof Instant ? (Instant) started : end;
        ExecutionStatus status = statusOf(context, jobException);
        Object items = context.get(WorkExecutorJob.ITEMS_PROCESSED);
        ExecutionLogEntry entry = new ExecutionLogEntry(
                key.getName(),
                key.getGroup(),
                start,
                end,
                status,
                jobException == null ? null : jobException.getMessage(),
                jobException == null ? null : stackTraceOf(jobException),
                items instanceof Integer ? (Integer) items : 0);
        Metrics.getInstance().recordExecution(status, Duration.between(start, end).toMillis());
        if (status == ExecutionStatus.FAILED) {
            log.info("Job {} failed after {} ms: {}", key, entry.getDuration().toMillis(), entry.getErrorMessage());
        } else {
            log.info("Job {} finished {} in {} ms, {} items", key, status,
                    entry.getDuration().toMillis(), entry.getItemsProcessed());
        }
        try {
            store.appendExecutionLog(entry);
            store.updateLastExecution(key.getName(), key.getGroup(), end, status);
        } catch (JobStoreException | RuntimeException e) {
            log.error("Failed to record execution of job {}", key, e);
        }
    }

    static ExecutionStatus statusOf(JobExecutionContext context, JobExecutionException jobException) {
        if (jobException != null) {
            return ExecutionStatus.FAILED;
        }
        if (Boolean.TRUE.equals(context.get(WorkExecutorJob.CANCELLED))) {
            return ExecutionStatus.CANCELLED;
        }
        return ExecutionStatus.SUCCESS;
    }

    private static String stackTraceOf(Throwable t) {
        StringWriter out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}

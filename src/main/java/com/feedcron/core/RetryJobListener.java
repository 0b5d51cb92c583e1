package com.feedcron.core;

import com.feedcron.jobs.RetrySettings;
import org.quartz.CronTrigger;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.JobKey;
import org.quartz.JobListener;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Date;

/**
 * Retries failed runs with exponential backoff through one-shot triggers that
 * sit alongside the job's recurring trigger. A success resets the retry count.
 */
public class RetryJobListener implements JobListener {
    private static final Logger log = LoggerFactory.getLogger(RetryJobListener.class);

    private final SchedulingEngine engine;
    private final Clock clock;

    public RetryJobListener(SchedulingEngine engine) {
        this(engine, Clock.systemUTC());
    }

    public RetryJobListener(SchedulingEngine engine, Clock clock) {
        this.engine = engine;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "RetryJobListener";
    }

    @Override
    public void jobToBeExecuted(JobExecutionContext context) {
    }

    @Override
    public void jobExecutionVetoed(JobExecutionContext context) {
    }

    @Override
    public void jobWasExecuted(JobExecutionContext context, JobExecutionException jobException) {
        // The context's job data is what gets persisted back onto the live job after this run.
        JobDataMap data = context.getJobDetail().getJobDataMap();
        if (jobException == null) {
            if (data.containsKey(RetrySettings.RETRY_COUNT_KEY)) {
                data.put(RetrySettings.RETRY_COUNT_KEY, "0");
            }
            return;
        }

        JobKey key = context.getJobDetail().getKey();
        RetrySettings retry = RetrySettings.from(data.getWrappedMap());
        if (retry.isExhausted()) {
            log.error("Job {} failed and has used all {} retries; waiting for its next scheduled run",
                    key, retry.getMaxRetries());
            Metrics.getInstance().recordRetryExhausted();
            return;
        }

        int attempt = retry.getRetryCount() + 1;
        long delaySeconds = retry.nextDelaySeconds();
        Date fireAt = Date.from(clock.instant().plusSeconds(delaySeconds));
        log.warn("Job {} failed (attempt {}/{}), retrying in {} s", key, attempt, retry.getMaxRetries(), delaySeconds);

        data.put(RetrySettings.RETRY_COUNT_KEY, String.valueOf(attempt));
        JobDataMap retryData = new JobDataMap();
        retryData.putAll(data);
        try {
            JobDetail updated = context.getJobDetail().getJobBuilder().usingJobData(retryData).build();
            engine.addJob(updated, true);
            Trigger trigger = JobTriggers.retryTrigger(key, attempt, fireAt, retryData);
            if (engine.checkExists(trigger.getKey())) {
                engine.rescheduleJob(trigger.getKey(), trigger);
            } else {
                engine.scheduleTrigger(trigger);
            }
            // New triggers start unpaused even when the job is paused.
            if (isPaused(key)) {
                engine.pauseTrigger(trigger.getKey());
                log.info("Job {} is paused, retry {} will wait for resume", key, attempt);
            }
            Metrics.getInstance().recordRetryScheduled();
        } catch (SchedulerException | RuntimeException e) {
            log.error("Failed to schedule retry {} of job {}", attempt, key, e);
        }
    }

    private boolean isPaused(JobKey key) throws SchedulerException {
        CronTrigger cron = JobTriggers.findCronTrigger(engine.getTriggersOfJob(key));
        return cron != null && engine.getTriggerState(cron.getKey()) == Trigger.TriggerState.PAUSED;
    }
}

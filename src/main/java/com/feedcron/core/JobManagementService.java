package com.feedcron.core;

import com.feedcron.jobs.JobType;
import com.feedcron.store.ExecutionLogEntry;
import com.feedcron.store.JobDefinition;
import com.feedcron.store.JobStore;
import com.feedcron.store.JobStoreException;
import com.feedcron.store.MisfirePolicy;
import org.quartz.CronTrigger;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Administrative operations on scheduled jobs. A job the engine does not know
 * yields {@code false} or an empty result, never an exception. The engine is
 * updated first; the follow-up store write is best effort.
 */
public class JobManagementService {
    private static final Logger log = LoggerFactory.getLogger(JobManagementService.class);

    private final SchedulingEngine engine;
    private final JobStore store;
    private final ScheduledJobFactory jobs;

    public JobManagementService(SchedulingEngine engine, JobStore store, ScheduledJobFactory jobs) {
        this.engine = engine;
        this.store = store;
        this.jobs = jobs;
    }

    /** Every job registered with the engine, across all groups. */
    public List<JobInfo> listJobs() throws SchedulerException {
        List<JobInfo> result = new ArrayList<>();
        for (String group : engine.getJobGroupNames()) {
            for (JobKey key : engine.getJobKeys(group)) {
                JobInfo info = jobInfo(key);
                if (info != null) {
                    result.add(info);
                }
            }
        }
        return result;
    }

    public Optional<JobInfo> getJob(String jobKey, String jobGroup) throws SchedulerException {
        return Optional.ofNullable(jobInfo(new JobKey(jobKey, jobGroup)));
    }

    private JobInfo jobInfo(JobKey key) throws SchedulerException {
        JobDetail detail = engine.getJobDetail(key);
        if (detail == null) {
            return null;
        }
        CronTrigger cron = JobTriggers.findCronTrigger(engine.getTriggersOfJob(key));
        Optional<JobDefinition> definition = readDefinition(key);
        JobType type = JobType.forJobClass(detail.getJobClass());
        Instant next = cron == null || cron.getNextFireTime() == null ? null : cron.getNextFireTime().toInstant();
        boolean paused = cron != null && engine.getTriggerState(cron.getKey()) == Trigger.TriggerState.PAUSED;
        return new JobInfo(
                key.getName(),
                key.getGroup(),
                type == null ? detail.getJobClass().getSimpleName() : type.getTypeName(),
                detail.getDescription(),
                cron == null ? null : cron.getCronExpression(),
                definition.map(JobDefinition::getLastExecutionTime).orElse(null),
                next,
                definition.map(JobDefinition::getLastStatus).orElse(null),
                paused);
    }

    /** Pauses every trigger of the job. Pausing a paused job succeeds. */
    public boolean pause(String jobKey, String jobGroup) throws SchedulerException {
        JobKey key = new JobKey(jobKey, jobGroup);
        if (!engine.checkExists(key)) {
            log.warn("Cannot pause job {}: not found", key);
            return false;
        }
        for (Trigger trigger : engine.getTriggersOfJob(key)) {
            engine.pauseTrigger(trigger.getKey());
        }
        savePauseState(key, true);
        log.info("Paused job {}", key);
        return true;
    }

    public boolean resume(String jobKey, String jobGroup) throws SchedulerException {
        JobKey key = new JobKey(jobKey, jobGroup);
        if (!engine.checkExists(key)) {
            log.warn("Cannot resume job {}: not found", key);
            return false;
        }
        for (Trigger trigger : engine.getTriggersOfJob(key)) {
            engine.resumeTrigger(trigger.getKey());
        }
        savePauseState(key, false);
        log.info("Resumed job {}", key);
        return true;
    }

    /** Fires the job once now. The recurring schedule and retry count are untouched. */
    public boolean triggerNow(String jobKey, String jobGroup) throws SchedulerException {
        JobKey key = new JobKey(jobKey, jobGroup);
        if (!engine.checkExists(key)) {
            log.warn("Cannot trigger job {}: not found", key);
            return false;
        }
        engine.triggerJob(key);
        log.info("Triggered job {}", key);
        return true;
    }

    /**
     * Replaces the job's cron trigger, keeping the persisted misfire policy and
     * the paused state. Pending retry triggers are left alone.
     *
     * @return false if the job has no cron trigger or the expression is invalid
     */
    public boolean reschedule(String jobKey, String jobGroup, String cronExpression) throws SchedulerException {
        JobKey key = new JobKey(jobKey, jobGroup);
        CronTrigger current = JobTriggers.findCronTrigger(engine.getTriggersOfJob(key));
        if (current == null) {
            log.warn("Cannot reschedule job {}: no trigger found", key);
            return false;
        }
        if (!JobTriggers.isValidCron(cronExpression)) {
            log.warn("Cannot reschedule job {}: invalid cron expression '{}'", key, cronExpression);
            return false;
        }
        Optional<JobDefinition> definition = readDefinition(key);
        MisfirePolicy policy = definition.map(JobDefinition::getMisfirePolicy).orElse(MisfirePolicy.FIRE_NOW);
        boolean paused = engine.getTriggerState(current.getKey()) == Trigger.TriggerState.PAUSED;

        CronTrigger replacement = JobTriggers.cronTrigger(key, cronExpression, policy);
        engine.rescheduleJob(current.getKey(), replacement);
        if (paused) {
            engine.pauseTrigger(replacement.getKey());
        }
        if (definition.isPresent()) {
            try {
                store.updateCronExpression(key.getName(), key.getGroup(), cronExpression);
            } catch (JobStoreException e) {
                log.error("Rescheduled job {} but could not persist the new cron expression", key, e);
            }
        }
        log.info("Rescheduled job {} to '{}'", key, cronExpression);
        return true;
    }

    /** Removes the job from the engine and the store. */
    public boolean deleteJob(String jobKey, String jobGroup) throws SchedulerException {
        JobKey key = new JobKey(jobKey, jobGroup);
        boolean live = engine.checkExists(key);
        try {
            boolean deleted = jobs.unscheduleJob(jobKey, jobGroup);
            if (!deleted) {
                log.warn("Cannot delete job {}: not found", key);
            }
            return deleted;
        } catch (JobStoreException e) {
            log.error("Deleted job {} from the scheduler but could not remove its definition", key, e);
            return live;
        }
    }

    /** Most recent runs first; empty when the store cannot be read. */
    public List<ExecutionLogEntry> getExecutionHistory(String jobKey, int limit) {
        try {
            return store.queryExecutionLog(jobKey, limit);
        } catch (JobStoreException e) {
            log.error("Could not read execution history of job {}", jobKey, e);
            return Collections.emptyList();
        }
    }

    private Optional<JobDefinition> readDefinition(JobKey key) {
        try {
            return store.get(key.getName(), key.getGroup());
        } catch (JobStoreException e) {
            log.error("Could not read definition of job {}", key, e);
            return Optional.empty();
        }
    }

    private void savePauseState(JobKey key, boolean paused) {
        try {
            store.updatePauseState(key.getName(), key.getGroup(), paused);
        } catch (JobStoreException e) {
            log.error("Could not persist paused={} for job {}", paused, key, e);
        }
    }
}

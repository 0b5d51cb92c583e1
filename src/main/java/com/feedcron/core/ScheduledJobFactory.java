package com.feedcron.core;

import com.feedcron.feeds.CleanupConfig;
import com.feedcron.feeds.FeedConfig;
import com.feedcron.feeds.FeedConfigRepository;
import com.feedcron.jobs.AnalyticsParameters;
import com.feedcron.jobs.CleanupParameters;
import com.feedcron.jobs.IngestionParameters;
import com.feedcron.jobs.JobParameters;
import com.feedcron.jobs.JobType;
import com.feedcron.jobs.SmartTaggingParameters;
import com.feedcron.jobs.WorkExecutorRegistry;
import com.feedcron.store.JobDefinition;
import com.feedcron.store.JobStore;
import com.feedcron.store.JobStoreException;
import com.feedcron.store.MisfirePolicy;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns domain requests into registered, persisted jobs and rebuilds the live
 * schedule from the job store at startup.
 */
public class ScheduledJobFactory {
    private static final Logger log = LoggerFactory.getLogger(ScheduledJobFactory.class);

    public static final String INGESTION_GROUP = "IngestionJobs";
    public static final String MAINTENANCE_GROUP = "MaintenanceJobs";

    public static final String CLEANUP_JOB = "cleanup";
    public static final String ANALYTICS_JOB = "analytics";
    public static final String SMART_TAGGING_JOB = "smart-tagging";

    private final SchedulingEngine engine;
    private final JobStore store;
    private final FeedConfigRepository feeds;
    private final WorkExecutorRegistry executors;

    public ScheduledJobFactory(SchedulingEngine engine, JobStore store,
                               FeedConfigRepository feeds, WorkExecutorRegistry executors) {
        this.engine = engine;
        this.store = store;
        this.feeds = feeds;
        this.executors = executors;
    }

    public static JobKey ingestionJobKey(String feedId) {
        return new JobKey("ingestion-" + feedId, INGESTION_GROUP);
    }

    public JobBundle createIngestionJob(FeedConfig feed) {
        return build(ingestionJobKey(feed.getId()), "Ingest feed " + feed.getName(),
                IngestionParameters.forFeed(feed), feed.getCronExpression(), feed.getMisfirePolicy());
    }

    public JobBundle createCleanupJob(CleanupConfig config, String cron) {
        return build(new JobKey(CLEANUP_JOB, MAINTENANCE_GROUP), "Delete expired articles",
                new CleanupParameters(config.getRetentionDays()), cron, MisfirePolicy.DO_NOTHING);
    }

    public JobBundle createAnalyticsJob(String cron) {
        return build(new JobKey(ANALYTICS_JOB, MAINTENANCE_GROUP), "Aggregate daily analytics",
                new AnalyticsParameters(), cron, MisfirePolicy.DO_NOTHING);
    }

    public JobBundle createSmartTaggingJob(int batchSize, String cron) {
        return build(new JobKey(SMART_TAGGING_JOB, MAINTENANCE_GROUP), "Tag untagged articles",
                new SmartTaggingParameters(batchSize), cron, MisfirePolicy.DO_NOTHING);
    }

    private JobBundle build(JobKey key, String description, JobParameters params,
                            String cron, MisfirePolicy policy) {
        Map<String, String> data = params.toJobData();
        JobDetail job = jobDetail(key, params.getJobType(), description, data);
        Trigger trigger = JobTriggers.cronTrigger(key, cron, policy);
        JobDefinition definition = JobDefinition.builder()
                .jobKey(key.getName())
                .jobGroup(key.getGroup())
                .jobType(params.getJobType().getTypeName())
                .cronExpression(cron)
                .misfirePolicy(policy)
                .jobData(data)
                .build();
        return new JobBundle(job, trigger, definition);
    }

    private static JobDetail jobDetail(JobKey key, JobType type, String description, Map<String, String> data) {
        JobDataMap map = new JobDataMap();
        map.putAll(data);
        return JobBuilder.newJob(type.getJobClass())
                .withIdentity(key)
                .withDescription(description)
                .usingJobData(map)
                .storeDurably()
                .build();
    }

    public void scheduleJob(JobBundle bundle) throws SchedulerException, JobStoreException {
        scheduleJob(bundle.getJobDetail(), bundle.getTrigger(), bundle.getDefinition());
    }

    /**
     * Registers the job with the engine, replacing any job under the same key,
     * then persists its definition. If persisting fails the registration is
     * undone and the store failure is rethrown.
     */
    public void scheduleJob(JobDetail job, Trigger trigger, JobDefinition definition)
            throws SchedulerException, JobStoreException {
        JobKey key = job.getKey();
        if (engine.checkExists(key)) {
            log.info("Job {} already registered, replacing it", key);
            engine.deleteJob(key);
        }
        engine.scheduleJob(job, trigger);
        try {
            store.upsert(definition);
        } catch (JobStoreException e) {
            try {
                engine.deleteJob(key);
            } catch (SchedulerException rollback) {
                e.addSuppressed(rollback);
            }
            throw e;
        }
        log.info("Scheduled job {} with cron '{}'", key, definition.getCronExpression());
    }

    /**
     * Removes a job from the engine and its definition from the store.
     *
     * @return false if neither knew the job
     */
    public boolean unscheduleJob(String jobKey, String jobGroup) throws SchedulerException, JobStoreException {
        boolean live = engine.deleteJob(new JobKey(jobKey, jobGroup));
        boolean stored = store.delete(jobKey, jobGroup);
        if (live || stored) {
            log.info("Deleted job {}.{}", jobGroup, jobKey);
        }
        return live || stored;
    }

    /**
     * Re-registers every persisted job that is not live yet. A definition that
     * cannot be rebuilt is skipped; only a failure to list the store is raised.
     *
     * @return how many jobs were restored
     */
    public int restorePersistedJobs() throws JobStoreException {
        List<JobDefinition> definitions = store.listAll();
        int restored = 0;
        for (JobDefinition definition : definitions) {
            try {
                if (restore(definition)) {
                    restored++;
                }
            } catch (Exception e) {
                log.error("Failed to restore job {}.{}", definition.getJobGroup(), definition.getJobKey(), e);
            }
        }
        log.info("Restored {} of {} persisted jobs", restored, definitions.size());
        return restored;
    }

    private boolean restore(JobDefinition definition) throws Exception {
        JobKey key = new JobKey(definition.getJobKey(), definition.getJobGroup());
        if (engine.checkExists(key)) {
            log.debug("Job {} already live, not restoring", key);
            return false;
        }
        JobType type = JobType.fromName(definition.getJobType());
        if (type == null || !executors.supports(type)) {
            log.warn("Unknown job type '{}' for job {}, skipping", definition.getJobType(), key);
            return false;
        }

        JobDetail job;
        if (type == JobType.INGESTION) {
            String feedId = IngestionParameters.feedIdOf(definition.getJobData());
            Optional<FeedConfig> feed = feedId == null ? Optional.empty() : feeds.findById(feedId);
            if (feed.isEmpty()) {
                log.warn("Feed '{}' for job {} no longer exists, skipping", feedId, key);
                return false;
            }
            job = jobDetail(key, type, "Ingest feed " + feed.get().getName(),
                    IngestionParameters.forFeed(feed.get()).toJobData());
        } else {
            job = jobDetail(key, type, "Restored " + type.getTypeName(), definition.getJobData());
        }

        Trigger trigger = JobTriggers.cronTrigger(key, definition.getCronExpression(), definition.getMisfirePolicy());
        engine.scheduleJob(job, trigger);
        if (definition.isPaused()) {
            engine.pauseTrigger(trigger.getKey());
        }
        log.info("Restored job {} with cron '{}'{}", key, definition.getCronExpression(),
                definition.isPaused() ? " (paused)" : "");
        return true;
    }
}

package com.feedcron.core;

import com.feedcron.feeds.CleanupConfig;
import com.feedcron.store.JobStoreException;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the scheduling engine for the life of the process. Starting restores the
 * persisted schedule before any job can fire; shutting down signals running
 * jobs to stop and drains them.
 */
public class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final SchedulerConfig config;
    private final SchedulingEngine engine;
    private final ScheduledJobFactory jobs;
    private final JobManagementService management;
    private volatile boolean started;

    public JobScheduler(SchedulerConfig config, SchedulingEngine engine,
                        ScheduledJobFactory jobs, JobManagementService management) {
        this.config = config;
        this.engine = engine;
        this.jobs = jobs;
        this.management = management;
    }

    /**
     * Restores persisted jobs, seeds the maintenance jobs, starts the engine and
     * registers metrics. Restore and seeding failures are logged, never fatal.
     */
    public synchronized void start() throws SchedulerException {
        if (started) {
            return;
        }
        try {
            jobs.restorePersistedJobs();
        } catch (JobStoreException | RuntimeException e) {
            log.error("Could not restore persisted jobs, starting with an empty schedule", e);
        }
        if (config.isMaintenanceJobsEnabled()) {
            seedMaintenanceJobs();
        }
        engine.start();
        Metrics.init();
        if (config.getMetricsPort() >= 0) {
            MetricsServer.start(config.getMetricsPort());
        }
        started = true;
    }

    private void seedMaintenanceJobs() {
        seed(() -> jobs.createCleanupJob(new CleanupConfig(config.getRetentionDays()), config.getCleanupCron()));
        seed(() -> jobs.createAnalyticsJob(config.getAnalyticsCron()));
        seed(() -> jobs.createSmartTaggingJob(config.getSmartTaggingBatchSize(), config.getSmartTaggingCron()));
    }

    private interface BundleSupplier {
        JobBundle get();
    }

    private void seed(BundleSupplier supplier) {
        try {
            JobBundle bundle = supplier.get();
            if (!engine.checkExists(bundle.getJobDetail().getKey())) {
                jobs.scheduleJob(bundle);
            }
        } catch (SchedulerException | JobStoreException | RuntimeException e) {
            log.error("Could not seed maintenance job", e);
        }
    }

    public synchronized void shutdown() throws SchedulerException {
        if (config.isInterruptJobsOnShutdown()) {
            int interrupted = engine.interruptRunningJobs();
            if (interrupted > 0) {
                log.info("Requested cancellation of {} running jobs", interrupted);
            }
        }
        engine.shutdown(config.isWaitForJobsOnShutdown());
        MetricsServer.stop();
        started = false;
    }

    public boolean isStarted() {
        return started;
    }

    public ScheduledJobFactory getJobFactory() {
        return jobs;
    }

    public JobManagementService getManagementService() {
        return management;
    }

    public SchedulingEngine getEngine() {
        return engine;
    }
}

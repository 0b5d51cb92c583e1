package com.feedcron.core;

import com.feedcron.feeds.FeedConfigRepository;
import com.feedcron.jobs.ExecutorJobFactory;
import com.feedcron.jobs.WorkExecutorRegistry;
import com.feedcron.store.JobStore;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.impl.StdSchedulerFactory;

import java.time.Clock;
import java.util.Properties;

/**
 * Creates {@link JobScheduler} instances wired from a {@link SchedulerConfig}:
 * a Quartz engine with an in-memory trigger store, the executor-aware job
 * factory, and the guard, logging and retry listeners.
 */
public class JobSchedulerFactory {
    private final SchedulerConfig config;

    public JobSchedulerFactory() {
        this(SchedulerConfig.load());
    }

    public JobSchedulerFactory(SchedulerConfig config) {
        this.config = config;
    }

    public JobScheduler getScheduler(JobStore store, WorkExecutorRegistry executors,
                                     FeedConfigRepository feeds) throws SchedulerException {
        Scheduler quartz = new StdSchedulerFactory(quartzProperties(config)).getScheduler();
        quartz.setJobFactory(new ExecutorJobFactory(executors));

        QuartzSchedulingEngine engine = new QuartzSchedulingEngine(quartz);
        Clock clock = Clock.systemUTC();
        ConcurrentExecutionGuard guard = new ConcurrentExecutionGuard();
        engine.addTriggerListener(guard);
        engine.addJobListener(guard);
        engine.addJobListener(new ExecutionLogListener(store, clock));
        engine.addJobListener(new RetryJobListener(engine, clock));

        ScheduledJobFactory jobs = new ScheduledJobFactory(engine, store, feeds, executors);
        JobManagementService management = new JobManagementService(engine, store, jobs);
        return new JobScheduler(config, engine, jobs, management);
    }

    static Properties quartzProperties(SchedulerConfig config) {
        Properties p = new Properties();
        p.setProperty(StdSchedulerFactory.PROP_SCHED_INSTANCE_NAME, config.getSchedulerName());
        p.setProperty("org.quartz.scheduler.skipUpdateCheck", "true");
        p.setProperty(StdSchedulerFactory.PROP_THREAD_POOL_CLASS, "org.quartz.simpl.SimpleThreadPool");
        p.setProperty("org.quartz.threadPool.threadCount", String.valueOf(config.getThreadCount()));
        p.setProperty(StdSchedulerFactory.PROP_JOB_STORE_CLASS, "org.quartz.simpl.RAMJobStore");
        p.setProperty("org.quartz.jobStore.misfireThreshold", String.valueOf(config.getMisfireThresholdMillis()));
        return p;
    }
}

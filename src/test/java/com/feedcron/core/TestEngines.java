package com.feedcron.core;

import com.feedcron.jobs.ExecutorJobFactory;
import com.feedcron.jobs.JobType;
import com.feedcron.jobs.WorkExecutorRegistry;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.impl.StdSchedulerFactory;

import java.util.Properties;
import java.util.UUID;

/** Quartz engines for tests; each gets its own instance name. */
final class TestEngines {
    private TestEngines() {}

    static Properties config(String... keyValues) {
        Properties p = new Properties();
        p.setProperty("SCHEDULER_NAME", "test-" + UUID.randomUUID());
        p.setProperty("SCHEDULER_THREAD_COUNT", "4");
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            p.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return p;
    }

    /** An engine that is never started, for inspecting triggers. */
    static QuartzSchedulingEngine standby(WorkExecutorRegistry executors) throws SchedulerException {
        SchedulerConfig config = SchedulerConfig.fromProperties(config());
        Scheduler scheduler = new StdSchedulerFactory(JobSchedulerFactory.quartzProperties(config)).getScheduler();
        scheduler.setJobFactory(new ExecutorJobFactory(executors));
        return new QuartzSchedulingEngine(scheduler);
    }

    /** Every job type bound to an executor that does nothing. */
    static WorkExecutorRegistry noopExecutors() {
        WorkExecutorRegistry registry = new WorkExecutorRegistry();
        for (JobType type : JobType.values()) {
            registry.register(type, context -> { });
        }
        return registry;
    }
}

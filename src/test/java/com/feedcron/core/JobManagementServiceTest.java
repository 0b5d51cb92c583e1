package com.feedcron.core;

import com.feedcron.feeds.CleanupConfig;
import com.feedcron.feeds.FeedConfig;
import com.feedcron.jobs.AnalyticsJob;
import com.feedcron.store.ExecutionLogEntry;
import com.feedcron.store.ExecutionStatus;
import com.feedcron.store.FailingJobStore;
import com.feedcron.store.InMemoryJobStore;
import com.feedcron.store.JobDefinition;
import com.feedcron.store.MisfirePolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.quartz.CronTrigger;
import org.quartz.JobBuilder;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Trigger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class JobManagementServiceTest {
    private final InMemoryJobStore store = new InMemoryJobStore();
    private final JobKey cleanup = new JobKey("cleanup", ScheduledJobFactory.MAINTENANCE_GROUP);
    private final JobKey ingestion = ScheduledJobFactory.ingestionJobKey("42");
    private QuartzSchedulingEngine engine;
    private ScheduledJobFactory factory;
    private JobManagementService service;

    @BeforeEach
    public void setUp() throws Exception {
        engine = TestEngines.standby(TestEngines.noopExecutors());
        factory = new ScheduledJobFactory(engine, store, id -> Optional.empty(), TestEngines.noopExecutors());
        service = new JobManagementService(engine, store, factory);
        factory.scheduleJob(factory.createCleanupJob(new CleanupConfig(30), "0 0 3 * * ?"));
        factory.scheduleJob(factory.createIngestionJob(new FeedConfig("42", "Feed", "https://example.com/rss")));
    }

    @AfterEach
    public void tearDown() throws Exception {
        engine.shutdown(false);
    }

    private CronTrigger cronTrigger(JobKey key) throws Exception {
        return JobTriggers.findCronTrigger(engine.getTriggersOfJob(key));
    }

    @Test
    public void testPauseThenResume() throws Exception {
        assertTrue(service.pause("cleanup", "MaintenanceJobs"));
        assertEquals(Trigger.TriggerState.PAUSED, engine.getTriggerState(cronTrigger(cleanup).getKey()));
        assertTrue(store.get("cleanup", "MaintenanceJobs").orElseThrow().isPaused());
        assertTrue(service.getJob("cleanup", "MaintenanceJobs").orElseThrow().isPaused());

        assertTrue(service.pause("cleanup", "MaintenanceJobs"));

        assertTrue(service.resume("cleanup", "MaintenanceJobs"));
        assertEquals(Trigger.TriggerState.NORMAL, engine.getTriggerState(cronTrigger(cleanup).getKey()));
        assertFalse(store.get("cleanup", "MaintenanceJobs").orElseThrow().isPaused());
    }

    @Test
    public void testUnknownJobIsReportedNotThrown() throws Exception {
        assertFalse(service.pause("nope", "MaintenanceJobs"));
        assertFalse(service.resume("nope", "MaintenanceJobs"));
        assertFalse(service.triggerNow("nope", "MaintenanceJobs"));
        assertFalse(service.reschedule("nope", "MaintenanceJobs", "0 0 4 * * ?"));
        assertFalse(service.deleteJob("nope", "MaintenanceJobs"));
        assertTrue(service.getJob("nope", "MaintenanceJobs").isEmpty());
    }

    @Test
    public void testRescheduleKeepsMisfirePolicy() throws Exception {
        assertTrue(service.reschedule("cleanup", "MaintenanceJobs", "0 30 4 * * ?"));

        CronTrigger trigger = cronTrigger(cleanup);
        assertEquals("0 30 4 * * ?", trigger.getCronExpression());
        assertEquals(CronTrigger.MISFIRE_INSTRUCTION_DO_NOTHING, trigger.getMisfireInstruction());
        JobDefinition stored = store.get("cleanup", "MaintenanceJobs").orElseThrow();
        assertEquals("0 30 4 * * ?", stored.getCronExpression());
        assertEquals(MisfirePolicy.DO_NOTHING, stored.getMisfirePolicy());
    }

    @Test
    public void testRescheduleKeepsPausedJobPaused() throws Exception {
        service.pause("cleanup", "MaintenanceJobs");
        assertTrue(service.reschedule("cleanup", "MaintenanceJobs", "0 30 4 * * ?"));
        assertEquals(Trigger.TriggerState.PAUSED, engine.getTriggerState(cronTrigger(cleanup).getKey()));
    }

    @Test
    public void testRescheduleKeepsRunRecordedMeanwhile() throws Exception {
        Instant finished = Instant.parse("2026-03-01T03:00:00Z");
        InMemoryJobStore racing = new InMemoryJobStore() {
            @Override
            public synchronized Optional<JobDefinition> get(String jobKey, String jobGroup) {
                Optional<JobDefinition> read = super.get(jobKey, jobGroup);
                // a run completes right after the definition was read
                updateLastExecution(jobKey, jobGroup, finished, ExecutionStatus.FAILED);
                return read;
            }
        };
        racing.upsert(store.get("cleanup", "MaintenanceJobs").orElseThrow());
        JobManagementService racingService = new JobManagementService(engine, racing, factory);

        assertTrue(racingService.reschedule("cleanup", "MaintenanceJobs", "0 30 4 * * ?"));

        JobDefinition stored = racing.listAll().get(0);
        assertEquals("0 30 4 * * ?", stored.getCronExpression());
        assertEquals(finished, stored.getLastExecutionTime());
        assertEquals(ExecutionStatus.FAILED, stored.getLastStatus());
    }

    @Test
    public void testRescheduleRejectsInvalidCron() throws Exception {
        assertFalse(service.reschedule("cleanup", "MaintenanceJobs", "every night"));
        assertEquals("0 0 3 * * ?", cronTrigger(cleanup).getCronExpression());
    }

    @Test
    public void testRescheduleWithoutDefinitionFallsBackToFireNow() throws Exception {
        JobKey adhoc = new JobKey("adhoc", "MaintenanceJobs");
        JobDetail job = JobBuilder.newJob(AnalyticsJob.class).withIdentity(adhoc).storeDurably().build();
        engine.scheduleJob(job, JobTriggers.cronTrigger(adhoc, "0 0 1 * * ?", MisfirePolicy.DO_NOTHING));

        assertTrue(service.reschedule("adhoc", "MaintenanceJobs", "0 0 2 * * ?"));

        assertEquals(CronTrigger.MISFIRE_INSTRUCTION_FIRE_ONCE_NOW, cronTrigger(adhoc).getMisfireInstruction());
        assertTrue(store.get("adhoc", "MaintenanceJobs").isEmpty());
    }

    @Test
    public void testTriggerNowLeavesScheduleAlone() throws Exception {
        assertTrue(service.triggerNow("ingestion-42", "IngestionJobs"));

        List<? extends Trigger> triggers = engine.getTriggersOfJob(ingestion);
        assertEquals(2, triggers.size());
        assertEquals(FeedConfig.DEFAULT_CRON, cronTrigger(ingestion).getCronExpression());
    }

    @Test
    public void testListJobsMergesStoredExecutionSummary() throws Exception {
        Instant last = Instant.parse("2026-02-01T03:00:00Z");
        store.updateLastExecution("cleanup", "MaintenanceJobs", last, ExecutionStatus.FAILED);

        List<JobInfo> jobs = service.listJobs();
        assertEquals(2, jobs.size());
        JobInfo info = jobs.stream().filter(j -> j.getJobKey().equals("cleanup")).findFirst().orElseThrow();
        assertEquals("CleanupJob", info.getJobType());
        assertEquals("0 0 3 * * ?", info.getCronExpression());
        assertEquals(last, info.getLastExecutionTime());
        assertEquals(ExecutionStatus.FAILED, info.getLastStatus());
        assertNotNull(info.getNextExecutionTime());
        assertFalse(info.isPaused());

        JobInfo feed = service.getJob("ingestion-42", "IngestionJobs").orElseThrow();
        assertEquals("IngestionJob", feed.getJobType());
        assertNull(feed.getLastStatus());
    }

    @Test
    public void testDeleteJob() throws Exception {
        assertTrue(service.deleteJob("ingestion-42", "IngestionJobs"));
        assertFalse(engine.checkExists(ingestion));
        assertTrue(store.get("ingestion-42", "IngestionJobs").isEmpty());
    }

    @Test
    public void testHistory() throws Exception {
        Instant t0 = Instant.parse("2026-02-01T03:00:00Z");
        for (int i = 0; i < 4; i++) {
            store.appendExecutionLog(new ExecutionLogEntry("cleanup", "MaintenanceJobs",
                    t0.plusSeconds(i), t0.plusSeconds(i + 1), ExecutionStatus.SUCCESS, null, null, i));
        }
        List<ExecutionLogEntry> history = service.getExecutionHistory("cleanup", 2);
        assertEquals(2, history.size());
        assertEquals(3, history.get(0).getItemsProcessed());
    }

    @Test
    public void testStoreFailuresDoNotFailAdminOperations() throws Exception {
        FailingJobStore failing = new FailingJobStore();
        JobManagementService degraded = new JobManagementService(engine, failing, factory);
        failing.failWrites(true).failReads(true);

        assertTrue(degraded.pause("cleanup", "MaintenanceJobs"));
        assertTrue(degraded.resume("cleanup", "MaintenanceJobs"));
        assertTrue(degraded.reschedule("cleanup", "MaintenanceJobs", "0 0 5 * * ?"));
        assertTrue(degraded.getExecutionHistory("cleanup", 5).isEmpty());
        assertEquals(2, degraded.listJobs().size());
    }
}

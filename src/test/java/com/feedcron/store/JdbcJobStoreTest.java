package com.feedcron.store;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class JdbcJobStoreTest {
    private JdbcJobStore store;
    private String url;

    @BeforeEach
    public void setUp() throws Exception {
        url = "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL(url);
        store = new JdbcJobStore(ds);
    }

    private static JobDefinition ingestion(String cron) {
        return JobDefinition.builder()
                .jobKey("ingestion-42")
                .jobGroup("IngestionJobs")
                .jobType("IngestionJob")
                .cronExpression(cron)
                .misfirePolicy(MisfirePolicy.DO_NOTHING)
                .putJobData("FeedId", "42")
                .putJobData("MaxRetries", "3")
                .build();
    }

    @Test
    public void testUpsertAndGetRoundTrip() throws Exception {
        JobDefinition stored = store.upsert(ingestion("0 */15 * * * ?"));
        assertNotNull(stored.getId());
        assertNotNull(stored.getCreatedAt());

        JobDefinition loaded = store.get("ingestion-42", "IngestionJobs").orElseThrow();
        assertEquals("0 */15 * * * ?", loaded.getCronExpression());
        assertEquals(MisfirePolicy.DO_NOTHING, loaded.getMisfirePolicy());
        assertEquals(Map.of("FeedId", "42", "MaxRetries", "3"), loaded.getJobData());
        assertEquals(stored.getId(), loaded.getId());
        assertFalse(loaded.isPaused());
    }

    @Test
    public void testUpsertReplacesButKeepsIdentity() throws Exception {
        JobDefinition first = store.upsert(ingestion("0 */15 * * * ?"));
        JobDefinition second = store.upsert(ingestion("0 0 * * * ?").toBuilder()
                .jobData(Map.of("FeedId", "42"))
                .build());

        assertEquals(first.getId(), second.getId());
        JobDefinition loaded = store.get("ingestion-42", "IngestionJobs").orElseThrow();
        assertEquals("0 0 * * * ?", loaded.getCronExpression());
        assertEquals(Map.of("FeedId", "42"), loaded.getJobData());
        assertEquals(first.getCreatedAt().toEpochMilli(), loaded.getCreatedAt().toEpochMilli());
        assertEquals(1, store.listAll().size());
    }

    @Test
    public void testGetMissingIsEmpty() throws Exception {
        assertTrue(store.get("nope", "IngestionJobs").isEmpty());
    }

    @Test
    public void testDelete() throws Exception {
        store.upsert(ingestion("0 */15 * * * ?"));
        assertTrue(store.delete("ingestion-42", "IngestionJobs"));
        assertFalse(store.delete("ingestion-42", "IngestionJobs"));
        assertTrue(store.listAll().isEmpty());
    }

    @Test
    public void testTargetedUpdates() throws Exception {
        store.upsert(ingestion("0 */15 * * * ?"));
        Instant when = Instant.ofEpochMilli(1_700_000_000_000L);

        assertTrue(store.updatePauseState("ingestion-42", "IngestionJobs", true));
        assertTrue(store.updateLastExecution("ingestion-42", "IngestionJobs", when, ExecutionStatus.FAILED));
        assertFalse(store.updatePauseState("other", "IngestionJobs", true));

        JobDefinition loaded = store.get("ingestion-42", "IngestionJobs").orElseThrow();
        assertTrue(loaded.isPaused());
        assertEquals(when, loaded.getLastExecutionTime());
        assertEquals(ExecutionStatus.FAILED, loaded.getLastStatus());
        assertEquals("0 */15 * * * ?", loaded.getCronExpression());

        assertTrue(store.updateCronExpression("ingestion-42", "IngestionJobs", "0 0 * * * ?"));
        assertFalse(store.updateCronExpression("other", "IngestionJobs", "0 0 * * * ?"));
        loaded = store.get("ingestion-42", "IngestionJobs").orElseThrow();
        assertEquals("0 0 * * * ?", loaded.getCronExpression());
        assertEquals(when, loaded.getLastExecutionTime());
        assertTrue(loaded.isPaused());
    }

    @Test
    public void testExecutionLogMostRecentFirst() throws Exception {
        Instant t0 = Instant.ofEpochMilli(1_700_000_000_000L);
        for (int i = 0; i < 5; i++) {
            Instant start = t0.plusSeconds(i * 60L);
            store.appendExecutionLog(new ExecutionLogEntry("cleanup", "MaintenanceJobs", start,
                    start.plusMillis(250), ExecutionStatus.SUCCESS, null, null, i));
        }
        store.appendExecutionLog(new ExecutionLogEntry("analytics", "MaintenanceJobs", t0, t0,
                ExecutionStatus.FAILED, "boom", "trace", 0));

        List<ExecutionLogEntry> history = store.queryExecutionLog("cleanup", 3);
        assertEquals(3, history.size());
        assertEquals(4, history.get(0).getItemsProcessed());
        assertEquals(2, history.get(2).getItemsProcessed());
        assertEquals(250, history.get(0).getDuration().toMillis());

        ExecutionLogEntry failure = store.queryExecutionLog("analytics", 10).get(0);
        assertEquals(ExecutionStatus.FAILED, failure.getStatus());
        assertEquals("boom", failure.getErrorMessage());
        assertEquals("trace", failure.getStackTrace());

        assertTrue(store.queryExecutionLog("cleanup", 0).isEmpty());
    }

    @Test
    public void testLegacyMisfireNameIsReadable() throws Exception {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        JdbcJobStore legacy = new JdbcJobStore(ds);
        legacy.upsert(ingestion("0 */15 * * * ?"));
        try (var c = ds.getConnection(); var s = c.createStatement()) {
            s.executeUpdate("UPDATE job_definitions SET misfire_policy = 'RescheduleNextWithRemainingCount'");
        }
        assertEquals(MisfirePolicy.RESCHEDULE_IGNORING_MISFIRES,
                legacy.get("ingestion-42", "IngestionJobs").orElseThrow().getMisfirePolicy());
    }

    @Test
    public void testUnreadableStatusIsStoreFailure() throws Exception {
        Instant t0 = Instant.ofEpochMilli(1_700_000_000_000L);
        store.appendExecutionLog(new ExecutionLogEntry("cleanup", "MaintenanceJobs", t0, t0,
                ExecutionStatus.SUCCESS, null, null, 1));
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL(url);
        try (var c = ds.getConnection(); var s = c.createStatement()) {
            s.executeUpdate("UPDATE job_execution_log SET status = 'EXPLODED'");
        }
        assertThrows(JobStoreException.class, () -> store.queryExecutionLog("cleanup", 10));
    }
}

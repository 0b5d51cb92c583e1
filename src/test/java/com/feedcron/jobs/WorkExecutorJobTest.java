package com.feedcron.jobs;

import org.junit.jupiter.api.Test;
import org.quartz.JobBuilder;
import org.quartz.JobDetail;
import org.quartz.JobExecutionException;

import static org.junit.jupiter.api.Assertions.*;

public class WorkExecutorJobTest {
    private static JobDetail detail() {
        return JobBuilder.newJob(IngestionJob.class)
                .withIdentity("ingestion-7", "IngestionJobs")
                .usingJobData(IngestionParameters.FEED_ID_KEY, "7")
                .usingJobData(RetrySettings.MAX_RETRIES_KEY, 2)
                .build();
    }

    @Test
    public void testExecutorSeesJobDataAndReportsItems() throws Exception {
        StubJobExecutionContext ctx = new StubJobExecutionContext(detail());
        new IngestionJob(work -> {
            assertEquals("ingestion-7", work.getJobKey());
            assertEquals("7", work.getString(IngestionParameters.FEED_ID_KEY));
            assertEquals(2, work.getInt(RetrySettings.MAX_RETRIES_KEY, 5));
            work.setItemsProcessed(12);
        }).execute(ctx);

        assertEquals(12, ctx.get(WorkExecutorJob.ITEMS_PROCESSED));
        assertNull(ctx.get(WorkExecutorJob.CANCELLED));
    }

    @Test
    public void testFailureIsWrappedAndItemsStillRecorded() {
        StubJobExecutionContext ctx = new StubJobExecutionContext(detail());
        JobExecutionException e = assertThrows(JobExecutionException.class, () ->
                new IngestionJob(work -> {
                    work.setItemsProcessed(3);
                    throw new IllegalStateException("feed unreachable");
                }).execute(ctx));

        assertEquals("IngestionJob failed: feed unreachable", e.getMessage());
        assertTrue(e.getCause() instanceof IllegalStateException);
        assertEquals(3, ctx.get(WorkExecutorJob.ITEMS_PROCESSED));
    }

    @Test
    public void testInterruptRaisesCancellation() throws Exception {
        StubJobExecutionContext ctx = new StubJobExecutionContext(detail());
        CleanupJob[] job = new CleanupJob[1];
        job[0] = new CleanupJob(work -> {
            job[0].interrupt();
            assertTrue(work.isCancellationRequested());
            work.setItemsProcessed(1);
        });
        job[0].execute(ctx);

        assertEquals(Boolean.TRUE, ctx.get(WorkExecutorJob.CANCELLED));
        assertEquals(1, ctx.get(WorkExecutorJob.ITEMS_PROCESSED));
    }

    @Test
    public void testJobTypeNamesResolve() {
        assertEquals(JobType.SMART_TAGGING, JobType.fromName("SmartTaggingJob"));
        assertNull(JobType.fromName("FutureJob"));
        assertEquals(JobType.CLEANUP, JobType.forJobClass(CleanupJob.class));
        assertTrue(JobType.ANALYTICS.newJob(work -> { }) instanceof AnalyticsJob);
    }
}

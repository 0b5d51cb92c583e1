package com.feedcron.core;

import com.feedcron.store.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.management.JMException;
import javax.management.MBeanServer;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide job execution counters, exposed via JMX.
 */
public final class Metrics implements MetricsMBean {
    private static final Logger log = LoggerFactory.getLogger(Metrics.class);
    private static final Metrics INSTANCE = new Metrics();
    static final String OBJECT_NAME = "com.feedcron.core:type=Metrics";

    private final AtomicInteger successCount = new AtomicInteger();
    private final AtomicInteger failureCount = new AtomicInteger();
    private final AtomicInteger cancelledCount = new AtomicInteger();
    private final AtomicInteger vetoedCount = new AtomicInteger();
    private final AtomicInteger retriesScheduled = new AtomicInteger();
    private final AtomicInteger retriesExhausted = new AtomicInteger();
    private final AtomicLong totalDuration = new AtomicLong();
    private final AtomicInteger durationSamples = new AtomicInteger();

    private Metrics() {}

    public static Metrics getInstance() {
        return INSTANCE;
    }

    /**
     * Registers the MBean with the platform MBean server if not already registered.
     * A registration failure is logged; metrics keep counting either way.
     */
    public static void init() {
        try {
            MBeanServer server = ManagementFactory.getPlatformMBeanServer();
            ObjectName name = new ObjectName(OBJECT_NAME);
            if (!server.isRegistered(name)) {
                server.registerMBean(INSTANCE, name);
            }
        } catch (JMException e) {
            log.warn("Could not register metrics MBean {}", OBJECT_NAME, e);
        }
    }

    /** Count one finished run under its status and add its duration. */
    public void recordExecution(ExecutionStatus status, long durationMillis) {
        switch (status) {
            case SUCCESS:
                successCount.incrementAndGet();
                break;
            case FAILED:
                failureCount.incrementAndGet();
                break;
            case CANCELLED:
                cancelledCount.incrementAndGet();
                break;
            default:
                break;
        }
        totalDuration.addAndGet(Math.max(0, durationMillis));
        durationSamples.incrementAndGet();
    }

    public void recordVetoed() {
        vetoedCount.incrementAndGet();
    }

    public void recordRetryScheduled() {
        retriesScheduled.incrementAndGet();
    }

    public void recordRetryExhausted() {
        retriesExhausted.incrementAndGet();
    }

    @Override
    public int getSuccessCount() {
        return successCount.get();
    }

    @Override
    public int getFailureCount() {
        return failureCount.get();
    }

    @Override
    public int getCancelledCount() {
        return cancelledCount.get();
    }

    @Override
    public int getVetoedCount() {
        return vetoedCount.get();
    }

    @Override
    public int getRetriesScheduled() {
        return retriesScheduled.get();
    }

    @Override
    public int getRetriesExhausted() {
        return retriesExhausted.get();
    }

    @Override
    public long getTotalDurationMillis() {
        return totalDuration.get();
    }

    @Override
    public double getAverageDurationMillis() {
        int samples = durationSamples.get();
        if (samples == 0) {
            return 0.0;
        }
        return totalDuration.get() / (double) samples;
    }

    static void reset() {
        INSTANCE.successCount.set(0);
        INSTANCE.failureCount.set(0);
        INSTANCE.cancelledCount.set(0);
        INSTANCE.vetoedCount.set(0);
        INSTANCE.retriesScheduled.set(0);
        INSTANCE.retriesExhausted.set(0);
        INSTANCE.totalDuration.set(0);
        INSTANCE.durationSamples.set(0);
    }
}

package com.feedcron.core;

/**
 * JMX view of job execution counters.
 */
public interface MetricsMBean {
    int getSuccessCount();
    int getFailureCount();
    int getCancelledCount();
    int getVetoedCount();
    int getRetriesScheduled();
    int getRetriesExhausted();
    long getTotalDurationMillis();
    double getAverageDurationMillis();
}

package com.feedcron.jobs;

import java.util.Map;

/**
 * Retry bookkeeping carried in a job's data map: how many automatic retries a
 * failing job gets, the base of the exponential delay, and how many retries
 * have been used since the last success.
 */
public final class RetrySettings {
    public static final String RETRY_COUNT_KEY = "RetryCount";
    public static final String MAX_RETRIES_KEY = "MaxRetries";
    public static final String BASE_DELAY_SECONDS_KEY = "BaseDelaySeconds";

    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final int DEFAULT_BASE_DELAY_SECONDS = 1;
    /** Exponent ceiling; base 1s tops out at 1024s. */
    public static final int MAX_BACKOFF_EXPONENT = 10;

    private final int retryCount;
    private final int maxRetries;
    private final int baseDelaySeconds;

    public RetrySettings(int retryCount, int maxRetries, int baseDelaySeconds) {
        this.retryCount = Math.max(0, retryCount);
        this.maxRetries = Math.max(0, maxRetries);
        this.baseDelaySeconds = Math.max(0, baseDelaySeconds);
    }

    /** Fresh settings for a newly created job. */
    public static RetrySettings initial(int maxRetries) {
        return new RetrySettings(0, maxRetries, DEFAULT_BASE_DELAY_SECONDS);
    }

    /** Reads the settings from a job data map, applying defaults for missing keys. */
    public static RetrySettings from(Map<String, ?> data) {
        return new RetrySettings(
                JobParameters.parseInt(data.get(RETRY_COUNT_KEY), 0),
                JobParameters.parseInt(data.get(MAX_RETRIES_KEY), DEFAULT_MAX_RETRIES),
                JobParameters.parseInt(data.get(BASE_DELAY_SECONDS_KEY), DEFAULT_BASE_DELAY_SECONDS));
    }

    /**
     * Delay before the next retry: {@code base * 2^min(retryCount, 10)} seconds.
     */
    public static long backoffDelaySeconds(int baseDelaySeconds, int retryCount) {
        int exponent = Math.min(Math.max(0, retryCount), MAX_BACKOFF_EXPONENT);
        return (long) baseDelaySeconds << exponent;
    }

    public long nextDelaySeconds() {
        return backoffDelaySeconds(baseDelaySeconds, retryCount);
    }

    public boolean isExhausted() {
        return retryCount >= maxRetries;
    }

    public int getRetryCount() { return retryCount; }
    public int getMaxRetries() { return maxRetries; }
    public int getBaseDelaySeconds() { return baseDelaySeconds; }

    void writeTo(Map<String, String> data) {
        data.put(MAX_RETRIES_KEY, String.valueOf(maxRetries));
        data.put(RETRY_COUNT_KEY, String.valueOf(retryCount));
        data.put(BASE_DELAY_SECONDS_KEY, String.valueOf(baseDelaySeconds));
    }
}

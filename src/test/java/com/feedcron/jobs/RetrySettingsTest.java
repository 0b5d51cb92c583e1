package com.feedcron.jobs;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RetrySettingsTest {
    @Test
    public void testBackoffDoublesUpToCap() {
        assertEquals(1, RetrySettings.backoffDelaySeconds(1, 0));
        assertEquals(2, RetrySettings.backoffDelaySeconds(1, 1));
        assertEquals(4, RetrySettings.backoffDelaySeconds(1, 2));
        assertEquals(1024, RetrySettings.backoffDelaySeconds(1, 10));
        assertEquals(1024, RetrySettings.backoffDelaySeconds(1, 25));
        assertEquals(30 * 1024L, RetrySettings.backoffDelaySeconds(30, 99));
    }

    @Test
    public void testDefaultsForMissingKeys() {
        RetrySettings settings = RetrySettings.from(new HashMap<>());
        assertEquals(0, settings.getRetryCount());
        assertEquals(RetrySettings.DEFAULT_MAX_RETRIES, settings.getMaxRetries());
        assertEquals(RetrySettings.DEFAULT_BASE_DELAY_SECONDS, settings.getBaseDelaySeconds());
        assertFalse(settings.isExhausted());
    }

    @Test
    public void testReadsStringsAndNumbers() {
        Map<String, Object> data = new HashMap<>();
        data.put(RetrySettings.RETRY_COUNT_KEY, "3");
        data.put(RetrySettings.MAX_RETRIES_KEY, 3);
        data.put(RetrySettings.BASE_DELAY_SECONDS_KEY, "not a number");
        RetrySettings settings = RetrySettings.from(data);
        assertTrue(settings.isExhausted());
        assertEquals(1, settings.getBaseDelaySeconds());
    }

    @Test
    public void testZeroMaxRetriesIsExhaustedImmediately() {
        assertTrue(RetrySettings.initial(0).isExhausted());
    }
}

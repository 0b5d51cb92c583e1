package com.feedcron.jobs;

import com.feedcron.feeds.FeedConfig;

import java.util.Map;

/**
 * Parameters of a feed ingestion job.
 */
public final class IngestionParameters extends JobParameters {
    public static final String FEED_ID_KEY = "FeedId";
    public static final String FEED_URL_KEY = "FeedUrl";
    public static final String FEED_NAME_KEY = "FeedName";

    private final String feedId;
    private final String feedUrl;
    private final String feedName;
    private final RetrySettings retry;

    public IngestionParameters(String feedId, String feedUrl, String feedName, RetrySettings retry) {
        this.feedId = feedId;
        this.feedUrl = feedUrl;
        this.feedName = feedName;
        this.retry = retry;
    }

    public static IngestionParameters forFeed(FeedConfig feed) {
        return new IngestionParameters(feed.getId(), feed.getUrl(), feed.getName(),
                RetrySettings.initial(feed.getMaxRetries()));
    }

    /** Reads the feed id a persisted ingestion definition refers to. */
    public static String feedIdOf(Map<String, String> jobData) {
        return jobData.get(FEED_ID_KEY);
    }

    @Override
    public JobType getJobType() {
        return JobType.INGESTION;
    }

    @Override
    protected void writeTo(Map<String, String> data) {
        data.put(FEED_ID_KEY, feedId);
        data.put(FEED_URL_KEY, feedUrl);
        data.put(FEED_NAME_KEY, feedName);
        retry.writeTo(data);
    }

    public String getFeedId() { return feedId; }
    public String getFeedUrl() { return feedUrl; }
    public String getFeedName() { return feedName; }
    public RetrySettings getRetry() { return retry; }
}

package com.feedcron.feeds;

import java.util.Optional;

/**
 * Owner of feed configuration. Consulted when an ingestion job is restored so the
 * job runs against the feed's current url and name rather than the persisted copy.
 */
public interface FeedConfigRepository {
    Optional<FeedConfig> findById(String feedId) throws Exception;
}

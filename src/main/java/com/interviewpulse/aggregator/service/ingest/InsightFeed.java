package com.interviewpulse.aggregator.service.ingest;

import java.time.Duration;
import java.util.List;

/**
 * Durable, at-least-once source of raw insight messages.
 *
 * <p>Messages returned by {@link #poll(Duration)} stay pending until acknowledged.
 */
public interface InsightFeed extends AutoCloseable {

    /** Prepares cursors (consumer groups, subscriptions). Idempotent. */
    void open();

    /**
     * Blocks up to {@code timeout} for new messages.
     *
     * @return messages in feed order; empty on timeout
     */
    List<FeedMessage> poll(Duration timeout);

    void acknowledge(FeedMessage message);

    @Override
    default void close() {
    }
}

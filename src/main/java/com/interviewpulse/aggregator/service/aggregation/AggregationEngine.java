package com.interviewpulse.aggregator.service.aggregation;

import com.interviewpulse.aggregator.domain.InsightBatch;
import com.interviewpulse.aggregator.domain.RawInsight;

import java.util.Set;

/**
 * Entry point of the aggregation core: buffers raw insights per session and turns them into
 * prioritized, rate-limited {@link InsightBatch}es on demand.
 *
 * <p>Implementations must be thread-safe: HTTP ingest, the stream ingest loop and the periodic
 * aggregation loop call into the same instance concurrently.
 */
public interface AggregationEngine {

    /**
     * Buffers a raw insight for its session.
     *
     * @return the session's buffer size after the append
     */
    int addInsight(RawInsight insight);

    /**
     * Aggregates the session's buffered insights. Never clears the buffer; does consume alert
     * cooldowns for the insights it promotes.
     */
    InsightBatch aggregate(String sessionId);

    /**
     * Ends a session: drops its buffer, its alert cooldowns and its id counter.
     *
     * @return number of buffered records discarded
     */
    int clearSession(String sessionId);

    /**
     * Drops the session's buffered records only; alert cooldowns and id numbering continue.
     *
     * @return number of buffered records discarded
     */
    int discardBuffered(String sessionId);

    int bufferSize(String sessionId);

    Set<String> activeSessions();
}

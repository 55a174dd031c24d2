package com.interviewpulse.aggregator.service.buffer;

import com.interviewpulse.aggregator.domain.RawInsight;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-session store of raw insights awaiting aggregation.
 *
 * <p>Each session maps to an immutable list that is replaced atomically through
 * {@link ConcurrentMap#compute}, so mutations of one session are mutually exclusive while
 * {@link #snapshot(String)} never observes a partially applied append. Eviction runs on every
 * {@link #add(String, RawInsight)}: records received more than {@code retention} ago are dropped.
 * A session that stops receiving records keeps its data until {@link #clear(String)}.
 *
 * <p>Thread-safe.
 */
public class RoundBuffer {

    private static final Logger LOG = LogManager.getLogger(RoundBuffer.class);

    private final ConcurrentMap<String, List<RawInsight>> sessions = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Clock clock;

    public RoundBuffer(Duration retention, Clock clock) {
        Objects.requireNonNull(retention, "retention");
        if (retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("retention must be positive, got: " + retention);
        }
        this.retention = retention;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Appends a record stamped with the current time and evicts the session's expired records.
     *
     * @return the session's buffer size after the append
     */
    public int add(String sessionId, RawInsight record) {
        Objects.requireNonNull(record, "record");
        if (!record.sessionId().equals(sessionId)) {
            throw new IllegalArgumentException(
                    "record belongs to session " + record.sessionId() + ", not " + sessionId);
        }
        Instant now = clock.instant();
        RawInsight stamped = record.withReceivedAt(now);
        List<RawInsight> updated = sessions.compute(sessionId, (id, current) -> appendAndEvict(current, stamped, now));
        return updated.size();
    }

    private List<RawInsight> appendAndEvict(List<RawInsight> current, RawInsight stamped, Instant now) {
        Instant cutoff = now.minus(retention);
        List<RawInsight> next = new ArrayList<>(current == null ? 1 : current.size() + 1);
        if (current != null) {
            for (RawInsight r : current) {
                if (r.receivedAt().isAfter(cutoff)) {
                    next.add(r);
                }
            }
            int evicted = current.size() - next.size();
            if (evicted > 0) {
                LOG.debug("Evicted {} expired insight(s) for session {}", evicted, stamped.sessionId());
            }
        }
        next.add(stamped);
        return List.copyOf(next);
    }

    /** Current records of the session in arrival order; empty when unknown. No eviction. */
    public List<RawInsight> snapshot(String sessionId) {
        return sessions.getOrDefault(sessionId, List.of());
    }

    public int size(String sessionId) {
        return snapshot(sessionId).size();
    }

    /** Removes the session entirely. Returns the number of records discarded. */
    public int clear(String sessionId) {
        List<RawInsight> removed = sessions.remove(sessionId);
        return removed == null ? 0 : removed.size();
    }

    /** Session ids holding at least one record. */
    public Set<String> activeSessions() {
        return Set.copyOf(sessions.keySet());
    }
}

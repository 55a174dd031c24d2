package com.interviewpulse.aggregator.service.aggregation;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Session-scoped, monotonically increasing ids of the form {@code "{sessionId}-{n}"}.
 */
public class InsightIdGenerator {

    private final ConcurrentMap<String, AtomicLong> counters = new ConcurrentHashMap<>();

    public String nextId(String sessionId) {
        long n = counters.computeIfAbsent(sessionId, id -> new AtomicLong()).incrementAndGet();
        return sessionId + "-" + n;
    }

    /** Restarts numbering for the session; called when its round ends. */
    public void reset(String sessionId) {
        counters.remove(sessionId);
    }
}

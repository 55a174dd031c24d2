package com.interviewpulse.aggregator.testutil;

import com.interviewpulse.aggregator.domain.AggregatedInsight;
import com.interviewpulse.aggregator.domain.InsightCategory;
import com.interviewpulse.aggregator.domain.InsightData;
import com.interviewpulse.aggregator.domain.RawInsight;
import com.interviewpulse.aggregator.domain.Severity;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for domain objects used across tests.
 */
public final class Insights {

    private Insights() {
    }

    public static RawInsight raw(String sessionId, String source, String type, double confidence) {
        return raw(sessionId, source, type, Map.of(InsightData.CONFIDENCE, confidence));
    }

    public static RawInsight raw(String sessionId, String source, String type, Map<String, ?> data) {
        return RawInsight.of(sessionId, source, type, InsightData.of(data));
    }

    /** Raw insight whose producer declares the grouping category explicitly. */
    public static RawInsight declared(String sessionId, String source, String category, String type, double confidence) {
        Map<String, Object> data = new HashMap<>();
        data.put(InsightData.CATEGORY, category);
        data.put(InsightData.CONFIDENCE, confidence);
        return raw(sessionId, source, type, data);
    }

    public static AggregatedInsight aggregated(String id, InsightCategory category, String type,
                                               double confidence, Severity severity) {
        String sessionId = id.contains("-") ? id.substring(0, id.lastIndexOf('-')) : id;
        return new AggregatedInsight(id, sessionId, category, type, confidence, severity,
                "title", "description", List.of(), List.of("test"), List.of(), false,
                Instant.parse("2026-01-01T00:00:00Z"));
    }
}

package com.interviewpulse.aggregator.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Result of one aggregation pass over a session's buffer.
 *
 * @param sessionId       session the batch belongs to
 * @param insights        insights in priority order
 * @param recommendations recommendations for the alerted insights
 * @param summary         rollup over {@code insights}
 * @param timestamp       when the batch was produced
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InsightBatch(
        String sessionId,
        List<AggregatedInsight> insights,
        List<Recommendation> recommendations,
        InsightSummary summary,
        Instant timestamp
) {

    public InsightBatch {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        insights = insights == null ? List.of() : List.copyOf(insights);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        summary = summary == null ? InsightSummary.empty() : summary;
    }

    public static InsightBatch empty(String sessionId, Instant timestamp) {
        return new InsightBatch(sessionId, List.of(), List.of(), InsightSummary.empty(), timestamp);
    }

    public boolean isEmpty() {
        return insights.isEmpty();
    }

    public List<AggregatedInsight> alerts() {
        return insights.stream().filter(AggregatedInsight::alert).toList();
    }
}

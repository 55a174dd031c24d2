package com.interviewpulse.aggregator.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Rollup statistics over the insights delivered in one batch.
 *
 * @param totalInsights     number of delivered insights
 * @param alertsCount       how many of them are alerts
 * @param byCategory        count per category wire name
 * @param bySeverity        count per severity wire name
 * @param overallConfidence mean confidence over the delivered insights (0 when empty)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InsightSummary(
        int totalInsights,
        int alertsCount,
        Map<String, Integer> byCategory,
        Map<String, Integer> bySeverity,
        double overallConfidence
) {

    private static final InsightSummary EMPTY = new InsightSummary(0, 0, Map.of(), Map.of(), 0.0);

    public InsightSummary {
        byCategory = byCategory == null ? Map.of() : Map.copyOf(byCategory);
        bySeverity = bySeverity == null ? Map.of() : Map.copyOf(bySeverity);
    }

    public static InsightSummary empty() {
        return EMPTY;
    }
}

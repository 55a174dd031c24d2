package com.interviewpulse.aggregator.service.recommendation;

import com.interviewpulse.aggregator.domain.AggregatedInsight;
import com.interviewpulse.aggregator.domain.InsightSummary;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rolls up the final insight set of a batch: counts by category and severity, alert count and
 * mean confidence.
 */
public class SummaryBuilder {

    public InsightSummary build(List<AggregatedInsight> insights) {
        if (insights == null || insights.isEmpty()) {
            return InsightSummary.empty();
        }
        Map<String, Integer> byCategory = new LinkedHashMap<>();
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        int alerts = 0;
        double confidenceSum = 0.0;
        for (AggregatedInsight insight : insights) {
            byCategory.merge(insight.category().wireName(), 1, Integer::sum);
            bySeverity.merge(insight.severity().wireName(), 1, Integer::sum);
            if (insight.alert()) {
                alerts++;
            }
            confidenceSum += insight.confidence();
        }
        return new InsightSummary(insights.size(), alerts, byCategory, bySeverity,
                confidenceSum / insights.size());
    }
}

package com.interviewpulse.aggregator.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * Risk assessment of an interview so far, derived from its aggregated insights.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OverallAssessment(
        String sessionId,
        int interviewDurationMinutes,
        Severity riskLevel,
        String riskExplanation,
        int fraudIndicators,
        int contradictionsFound,
        int totalInsights,
        List<String> nextSteps,
        Instant generatedAt
) {

    public OverallAssessment {
        nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
    }
}

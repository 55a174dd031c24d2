package com.interviewpulse.aggregator.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Scored synthesis of one or more raw insights sharing (category, type) within a session.
 *
 * <p>Immutable; {@link #withAlert(boolean)} returns a copy carrying the alert decision.
 *
 * @param id                session-scoped id, {@code "{sessionId}-{n}"}
 * @param sessionId         owning session
 * @param category          category derived from the contributing producers
 * @param insightType       producer-defined type shared by the group
 * @param confidence        mean confidence (multi-source boost applied), in [0,1]
 * @param severity          aggregated severity
 * @param title             human-readable title
 * @param description       human-readable description
 * @param evidence          deduplicated evidence, first-seen order, capped
 * @param sourceServices    distinct contributing producers, first-seen order
 * @param followupQuestions deduplicated follow-up questions, first-seen order, capped
 * @param alert             whether the alert gate promoted this insight
 * @param timestamp         when the insight was built
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AggregatedInsight(
        String id,
        String sessionId,
        InsightCategory category,
        String insightType,
        double confidence,
        Severity severity,
        String title,
        String description,
        List<String> evidence,
        List<String> sourceServices,
        List<String> followupQuestions,
        @JsonProperty("is_alert") boolean alert,
        Instant timestamp
) {

    public AggregatedInsight {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(insightType, "insightType must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        sourceServices = sourceServices == null ? List.of() : List.copyOf(sourceServices);
        followupQuestions = followupQuestions == null ? List.of() : List.copyOf(followupQuestions);
    }

    public AggregatedInsight withAlert(boolean isAlert) {
        if (isAlert == alert) {
            return this;
        }
        return new AggregatedInsight(id, sessionId, category, insightType, confidence, severity, title,
                description, evidence, sourceServices, followupQuestions, isAlert, timestamp);
    }
}

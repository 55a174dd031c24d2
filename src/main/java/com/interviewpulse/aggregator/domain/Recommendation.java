package com.interviewpulse.aggregator.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Interviewer-facing suggestion derived from one alerted insight.
 *
 * @param type               action, clarification or observation
 * @param priority           delivery priority
 * @param title              short title
 * @param description        explanation shown to the interviewer
 * @param suggestedActions   things the interviewer can do (may be empty)
 * @param suggestedQuestions questions the interviewer can ask (may be empty)
 * @param relatedInsightId   id of the originating {@link AggregatedInsight}
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Recommendation(
        Type type,
        Priority priority,
        String title,
        String description,
        List<String> suggestedActions,
        List<String> suggestedQuestions,
        String relatedInsightId
) {

    public enum Type {
        ACTION, CLARIFICATION, OBSERVATION;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Priority {
        HIGH, MEDIUM, LOW;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public Recommendation {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(relatedInsightId, "relatedInsightId must not be null");
        suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
        suggestedQuestions = suggestedQuestions == null ? List.of() : List.copyOf(suggestedQuestions);
    }
}

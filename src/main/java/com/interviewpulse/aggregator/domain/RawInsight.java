package com.interviewpulse.aggregator.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Objects;

/**
 * Unprocessed observation from one upstream analyzer about one session.
 *
 * @param sessionId  interview session (round) the observation belongs to
 * @param source     producer identity, e.g. {@code fraud-detection}
 * @param type       producer-defined insight type, e.g. {@code multiple_faces}
 * @param receivedAt ingest time set by the buffer; {@code null} until stored
 * @param data       producer-specific payload
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RawInsight(
        String sessionId,
        String source,
        String type,
        Instant receivedAt,
        InsightData data
) {

    public static final String UNKNOWN = "unknown";

    public RawInsight {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        if (sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        source = source == null || source.isBlank() ? UNKNOWN : source;
        type = type == null || type.isBlank() ? UNKNOWN : type;
        data = data == null ? InsightData.empty() : data;
    }

    /**
     * Creates an insight that has not been stored yet.
     */
    public static RawInsight of(String sessionId, String source, String type, InsightData data) {
        return new RawInsight(sessionId, source, type, null, data);
    }

    public RawInsight withReceivedAt(Instant at) {
        return new RawInsight(sessionId, source, type, Objects.requireNonNull(at, "at"), data);
    }

    /**
     * Category used for grouping: the one declared in {@code data.category} when it is a known
     * category, otherwise the one implied by the producing service.
     */
    public InsightCategory category() {
        return data.declaredCategory().orElseGet(() -> InsightCategory.fromSource(source));
    }
}

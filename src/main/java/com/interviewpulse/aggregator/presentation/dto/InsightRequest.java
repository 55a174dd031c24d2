package com.interviewpulse.aggregator.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.interviewpulse.aggregator.domain.InsightData;
import com.interviewpulse.aggregator.domain.RawInsight;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Raw insight submitted by an analyzer over HTTP.
 *
 * @param sessionId session (round) id; also accepted as {@code round_id} or {@code sessionId}
 * @param timestamp producer-side timestamp, informational only
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InsightRequest(
        @NotBlank(message = "session_id is required")
        @JsonAlias({"round_id", "sessionId"})
        String sessionId,
        @NotBlank(message = "type is required")
        String type,
        @NotBlank(message = "source is required")
        String source,
        String timestamp,
        Map<String, Object> data
) {

    public RawInsight toRawInsight() {
        return RawInsight.of(sessionId.trim(), source, type, InsightData.of(data));
    }
}

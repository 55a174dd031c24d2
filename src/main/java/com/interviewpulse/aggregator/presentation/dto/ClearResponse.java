package com.interviewpulse.aggregator.presentation.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ClearResponse(String status, String sessionId, int discarded) {

    public static ClearResponse cleared(String sessionId, int discarded) {
        return new ClearResponse("cleared", sessionId, discarded);
    }
}

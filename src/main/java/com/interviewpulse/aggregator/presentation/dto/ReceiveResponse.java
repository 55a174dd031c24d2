package com.interviewpulse.aggregator.presentation.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReceiveResponse(String status, String sessionId, int bufferSize) {

    public static ReceiveResponse received(String sessionId, int bufferSize) {
        return new ReceiveResponse("received", sessionId, bufferSize);
    }
}

package com.interviewpulse.aggregator.presentation.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BufferStatusResponse(String sessionId, int bufferSize, Instant timestamp) {
}

package com.interviewpulse.aggregator.exception;

/**
 * Thrown when an aggregated batch cannot be handed to the delivery channel.
 */
public class DeliveryException extends InsightAggregatorException {

    public DeliveryException(String sessionId, String message, Throwable cause) {
        super(message + " (session: " + sessionId + ")", cause);
    }
}

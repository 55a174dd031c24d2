package com.interviewpulse.aggregator.exception;

/**
 * Base exception for all insight-aggregator errors.
 * Domain exceptions extend this class so the REST boundary and scheduler loops can handle them uniformly.
 */
public class InsightAggregatorException extends RuntimeException {

    public InsightAggregatorException(String message) {
        super(message);
    }

    public InsightAggregatorException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.interviewpulse.aggregator.exception;

/**
 * Thrown when an incoming raw insight cannot be accepted: missing session id,
 * unparseable payload, or a payload of the wrong shape.
 */
public class MalformedInsightException extends InsightAggregatorException {

    private final String feed;
    private final String reason;

    public MalformedInsightException(String feed, String reason) {
        this(feed, reason, null);
    }

    public MalformedInsightException(String feed, String reason, Throwable cause) {
        super("Malformed insight from " + feed + ": " + reason, cause);
        this.feed = feed;
        this.reason = reason;
    }

    public String getFeed() {
        return feed;
    }

    public String getReason() {
        return reason;
    }
}

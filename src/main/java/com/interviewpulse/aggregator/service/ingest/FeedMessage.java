package com.interviewpulse.aggregator.service.ingest;

import java.util.Map;
import java.util.Objects;

/**
 * One undecoded message read from an {@link InsightFeed}.
 *
 * @param feed feed (stream key) the message was read from
 * @param messageId feed-assigned id used for acknowledgement
 * @param fields message fields as delivered by the feed
 */
public record FeedMessage(String feed, String messageId, Map<String, String> fields) {

    public FeedMessage {
        Objects.requireNonNull(feed, "feed");
        Objects.requireNonNull(messageId, "messageId");
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }
}

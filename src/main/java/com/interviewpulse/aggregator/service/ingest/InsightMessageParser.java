package com.interviewpulse.aggregator.service.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.interviewpulse.aggregator.domain.InsightData;
import com.interviewpulse.aggregator.domain.RawInsight;
import com.interviewpulse.aggregator.exception.MalformedInsightException;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes a feed message into a {@link RawInsight}.
 *
 * <p>The configured payload field must hold a JSON object with a session id under
 * {@code session_id}, {@code sessionId} or {@code round_id}; {@code source}, {@code type} and
 * {@code data} are optional. Anything else is rejected with {@link MalformedInsightException}.
 */
public class InsightMessageParser {

    private static final List<String> SESSION_ID_FIELDS = List.of("session_id", "sessionId", "round_id");
    private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() { };

    private final ObjectMapper mapper;
    private final String payloadField;

    public InsightMessageParser(ObjectMapper mapper, String payloadField) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.payloadField = Objects.requireNonNull(payloadField, "payloadField");
    }

    public RawInsight parse(FeedMessage message) {
        String payload = message.fields().get(payloadField);
        if (payload == null || payload.isBlank()) {
            throw new MalformedInsightException(message.feed(), "missing '" + payloadField + "' field");
        }

        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedInsightException(message.feed(), "payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedInsightException(message.feed(), "payload is not a JSON object");
        }

        String sessionId = sessionId(root);
        if (sessionId == null) {
            throw new MalformedInsightException(message.feed(), "missing session id");
        }

        JsonNode dataNode = root.get("data");
        InsightData data;
        if (dataNode == null || dataNode.isNull()) {
            data = InsightData.empty();
        } else if (dataNode.isObject()) {
            data = InsightData.of(mapper.convertValue(dataNode, DATA_TYPE));
        } else {
            throw new MalformedInsightException(message.feed(), "'data' is not a JSON object");
        }

        return RawInsight.of(sessionId, text(root, "source"), text(root, "type"), data);
    }

    private static String sessionId(JsonNode root) {
        for (String field : SESSION_ID_FIELDS) {
            String value = text(root, field);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isValueNode() && !node.isNull() ? node.asText() : null;
    }
}

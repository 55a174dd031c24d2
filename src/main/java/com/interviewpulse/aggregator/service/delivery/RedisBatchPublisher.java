package com.interviewpulse.aggregator.service.delivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.interviewpulse.aggregator.config.properties.DeliveryProperties;
import com.interviewpulse.aggregator.domain.InsightBatch;
import com.interviewpulse.aggregator.exception.DeliveryException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Objects;

/**
 * Publishes batches as JSON on the Redis pub/sub channel {@code {channelPrefix}{sessionId}}.
 */
public class RedisBatchPublisher implements BatchPublisher {

    private static final Logger LOG = LogManager.getLogger(RedisBatchPublisher.class);

    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final DeliveryProperties props;

    public RedisBatchPublisher(StringRedisTemplate redis, ObjectMapper mapper, DeliveryProperties props) {
        this.redis = Objects.requireNonNull(redis, "redis");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public void publishBatch(String sessionId, InsightBatch batch) {
        String payload;
        try {
            payload = mapper.writeValueAsString(batch);
        } catch (JsonProcessingException e) {
            throw new DeliveryException(sessionId, "Failed to serialize batch", e);
        }
        String channel = props.channelFor(sessionId);
        try {
            Long receivers = redis.convertAndSend(channel, payload);
            LOG.debug("Published {} insight(s) on {} to {} subscriber(s)", batch.insights().size(), channel, receivers);
        } catch (DataAccessException e) {
            throw new DeliveryException(sessionId, "Failed to publish batch on " + channel, e);
        }
    }
}

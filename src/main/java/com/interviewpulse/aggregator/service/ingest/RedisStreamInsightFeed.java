package com.interviewpulse.aggregator.service.ingest;

import com.interviewpulse.aggregator.config.properties.IngestProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link InsightFeed} over Redis streams read through one consumer group.
 *
 * <p>{@link #open()} creates the group on every configured stream (creating missing streams) and
 * tolerates {@code BUSYGROUP}. Each poll is a single {@code XREADGROUP ... >} across all streams.
 */
public class RedisStreamInsightFeed implements InsightFeed {

    private static final Logger LOG = LogManager.getLogger(RedisStreamInsightFeed.class);

    private final StringRedisTemplate redis;
    private final List<String> streams;
    private final String group;
    private final Consumer consumer;
    private final int batchSize;

    private volatile boolean opened;

    public RedisStreamInsightFeed(StringRedisTemplate redis, IngestProperties props) {
        this.redis = Objects.requireNonNull(redis, "redis");
        Objects.requireNonNull(props, "props");
        this.streams = List.copyOf(props.getStreams());
        this.group = props.getConsumerGroup();
        this.consumer = Consumer.from(props.getConsumerGroup(), props.getConsumerName());
        this.batchSize = props.getBatchSize();
    }

    @Override
    public void open() {
        if (opened) {
            return;
        }
        for (String stream : streams) {
            try {
                redis.opsForStream().createGroup(stream, ReadOffset.from("0"), group);
                LOG.info("Created consumer group {} on stream {}", group, stream);
            } catch (DataAccessException e) {
                String detail = String.valueOf(NestedExceptionUtils.getMostSpecificCause(e).getMessage());
                if (!detail.contains("BUSYGROUP")) {
                    throw e;
                }
                LOG.debug("Consumer group {} already exists on stream {}", group, stream);
            }
        }
        opened = true;
        LOG.info("Consuming {} stream(s) as {}/{}", streams.size(), group, consumer.getName());
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<FeedMessage> poll(Duration timeout) {
        StreamOffset<String>[] offsets = streams.stream()
                .map(s -> StreamOffset.create(s, ReadOffset.lastConsumed()))
                .toArray(StreamOffset[]::new);
        StreamReadOptions options = StreamReadOptions.empty().count(batchSize).block(timeout);

        List<MapRecord<String, Object, Object>> records = redis.opsForStream().read(consumer, options, offsets);
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        List<FeedMessage> out = new ArrayList<>(records.size());
        for (MapRecord<String, Object, Object> record : records) {
            Map<String, String> fields = new LinkedHashMap<>();
            record.getValue().forEach((k, v) -> {
                if (v != null) {
                    fields.put(String.valueOf(k), String.valueOf(v));
                }
            });
            out.add(new FeedMessage(record.getStream(), record.getId().getValue(), fields));
        }
        return out;
    }

    @Override
    public void acknowledge(FeedMessage message) {
        redis.opsForStream().acknowledge(message.feed(), group, message.messageId());
    }
}

package com.interviewpulse.aggregator.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the stream ingest loop.
 */
@ConfigurationProperties(prefix = "insights.ingest")
@Validated
public class IngestProperties {

    /** Enable/disable stream consumption. HTTP ingest stays available either way. */
    private boolean enabled = true;

    /** Feeds (stream keys) to consume. */
    @NotEmpty(message = "At least one ingest stream must be configured")
    private List<String> streams = new ArrayList<>(List.of(
            "speech:insights", "video:insights", "fraud:insights", "nlp:insights"));

    @NotBlank(message = "Consumer group must not be blank")
    private String consumerGroup = "aggregator-group";

    @NotBlank(message = "Consumer name must not be blank")
    private String consumerName = "aggregator-insight-aggregator";

    /** Field of each stream entry that carries the JSON raw insight. */
    @NotBlank(message = "Payload field must not be blank")
    private String payloadField = "insight";

    /** Maximum entries read per poll. */
    @Positive(message = "Batch size must be positive")
    private int batchSize = 20;

    /** Bounded blocking read so the loop can observe shutdown promptly. */
    @Positive(message = "Poll timeout must be positive")
    private long pollTimeoutMs = 5000;

    /** Pause after a feed-level error before polling again. */
    @Positive(message = "Error backoff must be positive")
    private long errorBackoffMs = 5000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getStreams() {
        return streams;
    }

    public void setStreams(List<String> streams) {
        this.streams = streams;
    }

    public String getConsumerGroup() {
        return consumerGroup;
    }

    public void setConsumerGroup(String consumerGroup) {
        this.consumerGroup = consumerGroup;
    }

    public String getConsumerName() {
        return consumerName;
    }

    public void setConsumerName(String consumerName) {
        this.consumerName = consumerName;
    }

    public String getPayloadField() {
        return payloadField;
    }

    public void setPayloadField(String payloadField) {
        this.payloadField = payloadField;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public long getPollTimeoutMs() {
        return pollTimeoutMs;
    }

    public void setPollTimeoutMs(long pollTimeoutMs) {
        this.pollTimeoutMs = pollTimeoutMs;
    }

    public long getErrorBackoffMs() {
        return errorBackoffMs;
    }

    public void setErrorBackoffMs(long errorBackoffMs) {
        this.errorBackoffMs = errorBackoffMs;
    }

    public Duration pollTimeout() {
        return Duration.ofMillis(pollTimeoutMs);
    }

    public Duration errorBackoff() {
        return Duration.ofMillis(errorBackoffMs);
    }
}

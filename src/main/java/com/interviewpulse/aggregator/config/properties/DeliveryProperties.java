package com.interviewpulse.aggregator.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the periodic aggregation loop and its delivery/persistence collaborators.
 */
@ConfigurationProperties(prefix = "insights.delivery")
@Validated
public class DeliveryProperties {

    /** Pub/sub channel prefix; the session id is appended. */
    @NotBlank(message = "Channel prefix must not be blank")
    private String channelPrefix = "insights:aggregated:";

    /** Enable/disable the periodic aggregation loop. */
    private boolean schedulerEnabled = true;

    /** Persist alerts and recommendations after each delivered batch. */
    private boolean persistenceEnabled = true;

    /** Clear a session's buffer once its batch was delivered. Off: records age out by window. */
    private boolean clearAfterDelivery = false;

    /** Pause after a loop-level error before the next tick. */
    @Positive(message = "Error backoff must be positive")
    private long errorBackoffMs = 5000;

    public String getChannelPrefix() {
        return channelPrefix;
    }

    public void setChannelPrefix(String channelPrefix) {
        this.channelPrefix = channelPrefix;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public void setSchedulerEnabled(boolean schedulerEnabled) {
        this.schedulerEnabled = schedulerEnabled;
    }

    public boolean isPersistenceEnabled() {
        return persistenceEnabled;
    }

    public void setPersistenceEnabled(boolean persistenceEnabled) {
        this.persistenceEnabled = persistenceEnabled;
    }

    public boolean isClearAfterDelivery() {
        return clearAfterDelivery;
    }

    public void setClearAfterDelivery(boolean clearAfterDelivery) {
        this.clearAfterDelivery = clearAfterDelivery;
    }

    public long getErrorBackoffMs() {
        return errorBackoffMs;
    }

    public void setErrorBackoffMs(long errorBackoffMs) {
        this.errorBackoffMs = errorBackoffMs;
    }

    public String channelFor(String sessionId) {
        return channelPrefix + sessionId;
    }

    public Duration errorBackoff() {
        return Duration.ofMillis(errorBackoffMs);
    }
}

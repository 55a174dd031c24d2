package com.interviewpulse.aggregator.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for ingest, aggregation, delivery and persistence.
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class AggregationMetrics {

    private static final String METRIC_PREFIX = "insights.aggregator";

    private final MeterRegistry registry;

    public AggregationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts a raw insight accepted into the buffer.
     *
     * @param source producing service (speech-analysis, fraud-detection, ...)
     */
    public void incrementIngested(String source) {
        Counter.builder(METRIC_PREFIX + ".ingested")
                .description("Raw insights accepted into the round buffer")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    /**
     * Counts a feed message dropped at ingest.
     *
     * @param reason short reason tag (malformed, missing_session, ...)
     */
    public void incrementDropped(String reason) {
        Counter.builder(METRIC_PREFIX + ".dropped")
                .description("Feed messages dropped at ingest")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAggregationLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".aggregation.latency")
                .description("Time taken to aggregate one session")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts an insight promoted to an alert.
     *
     * @param category insight category wire name
     */
    public void incrementAlert(String category) {
        Counter.builder(METRIC_PREFIX + ".alerts")
                .description("Insights promoted to alerts")
                .tag("category", category)
                .register(registry)
                .increment();
    }

    public void incrementDeliveryFailure() {
        Counter.builder(METRIC_PREFIX + ".delivery.failure")
                .description("Batches that could not be published")
                .register(registry)
                .increment();
    }

    /**
     * @param kind what failed to persist (insight, recommendation)
     */
    public void incrementPersistenceFailure(String kind) {
        Counter.builder(METRIC_PREFIX + ".persistence.failure")
                .description("Rows that could not be written")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}

package com.interviewpulse.aggregator.service.scheduling;

import com.interviewpulse.aggregator.config.properties.DeliveryProperties;
import com.interviewpulse.aggregator.domain.AggregatedInsight;
import com.interviewpulse.aggregator.domain.InsightBatch;
import com.interviewpulse.aggregator.domain.Recommendation;
import com.interviewpulse.aggregator.exception.DeliveryException;
import com.interviewpulse.aggregator.service.aggregation.AggregationEngine;
import com.interviewpulse.aggregator.service.delivery.BatchPublisher;
import com.interviewpulse.aggregator.service.metrics.AggregationMetrics;
import com.interviewpulse.aggregator.service.persistence.InsightStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Periodic loop: every {@code interval} aggregates each active session, publishes non-empty
 * batches and persists their alerts and recommendations.
 *
 * <p>Sessions are isolated: a failure while processing one is logged and the tick moves on.
 * A failed publish is counted and logged; the batch's alerts and recommendations are still
 * persisted and the buffer is kept.
 * A tick in progress always completes before a stop request is honored.
 */
public class AggregationScheduler extends AbstractSchedulerLoop {

    private static final Logger LOG = LogManager.getLogger(AggregationScheduler.class);

    static final String MDC_SESSION_ID = "sessionId";

    private final AggregationEngine engine;
    private final BatchPublisher publisher;
    private final InsightStore store;
    private final AggregationMetrics metrics;
    private final Duration interval;
    private final boolean clearAfterDelivery;

    public AggregationScheduler(AggregationEngine engine,
                                BatchPublisher publisher,
                                InsightStore store,
                                AggregationMetrics metrics,
                                DeliveryProperties props,
                                Duration interval,
                                Executor executor) {
        super("aggregation-scheduler", executor, props.errorBackoff(), props.isSchedulerEnabled());
        this.engine = Objects.requireNonNull(engine, "engine");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.store = props.isPersistenceEnabled() ? Objects.requireNonNull(store, "store") : InsightStore.NOOP;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.clearAfterDelivery = props.isClearAfterDelivery();
    }

    @Override
    protected void runOnce() {
        if (pause(interval)) {
            return;
        }
        tick();
    }

    /**
     * Processes every active session once.
     *
     * @return number of batches delivered
     */
    int tick() {
        int delivered = 0;
        for (String sessionId : engine.activeSessions()) {
            ThreadContext.put(MDC_SESSION_ID, sessionId);
            try {
                if (processSession(sessionId)) {
                    delivered++;
                }
            } catch (RuntimeException e) {
                LOG.error("Failed to aggregate session {}", sessionId, e);
            } finally {
                ThreadContext.remove(MDC_SESSION_ID);
            }
        }
        return delivered;
    }

    private boolean processSession(String sessionId) {
        if (engine.bufferSize(sessionId) == 0) {
            return false;
        }
        InsightBatch batch = engine.aggregate(sessionId);
        if (batch.isEmpty()) {
            return false;
        }

        boolean published = true;
        try {
            publisher.publishBatch(sessionId, batch);
        } catch (DeliveryException e) {
            LOG.error("Failed to publish batch for session {}; persisting anyway", sessionId, e);
            metrics.incrementDeliveryFailure();
            published = false;
        }

        for (AggregatedInsight insight : batch.alerts()) {
            store.persistInsight(insight);
        }
        for (Recommendation recommendation : batch.recommendations()) {
            store.persistRecommendation(sessionId, recommendation);
        }

        if (!published) {
            return false;
        }
        if (clearAfterDelivery) {
            engine.discardBuffered(sessionId);
        }
        LOG.info("Delivered {} insight(s), {} alert(s), {} recommendation(s)",
                batch.insights().size(), batch.summary().alertsCount(), batch.recommendations().size());
        return true;
    }
}

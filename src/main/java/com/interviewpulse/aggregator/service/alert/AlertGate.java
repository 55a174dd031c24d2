package com.interviewpulse.aggregator.service.alert;

import com.interviewpulse.aggregator.config.properties.AggregationProperties;
import com.interviewpulse.aggregator.domain.AggregatedInsight;
import com.interviewpulse.aggregator.domain.InsightCategory;
import com.interviewpulse.aggregator.domain.Severity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Promotes aggregated insights to alerts and rate-limits them per (session, category, type).
 *
 * <p>Decision order:
 * <ol>
 *   <li>a key promoted less than {@code minAlertInterval} ago is suppressed</li>
 *   <li>fraud promotes at {@code confidence >= fraudAlertConfidence}</li>
 *   <li>contradiction promotes at {@code confidence >= contradictionAlertConfidence}</li>
 *   <li>any category with high severity promotes at {@code confidence >= highSeverityAlertConfidence}</li>
 * </ol>
 * Only a promotion records a timestamp. The check and the update are a single atomic step per key,
 * so concurrent aggregation of the same session cannot double-promote.
 */
public class AlertGate {

    private static final Logger LOG = LogManager.getLogger(AlertGate.class);

    private final ConcurrentMap<AlertKey, Instant> lastPromoted = new ConcurrentHashMap<>();
    private final Duration minInterval;
    private final double fraudThreshold;
    private final double contradictionThreshold;
    private final double highSeverityThreshold;
    private final Clock clock;

    public AlertGate(AggregationProperties props, Clock clock) {
        Objects.requireNonNull(props, "props");
        this.minInterval = props.minAlertInterval();
        this.fraudThreshold = props.getFraudAlertConfidence();
        this.contradictionThreshold = props.getContradictionAlertConfidence();
        this.highSeverityThreshold = props.getHighSeverityAlertConfidence();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns true and starts the key's cooldown when the insight qualifies as an alert.
     */
    public boolean shouldAlert(AggregatedInsight insight) {
        Objects.requireNonNull(insight, "insight");
        AlertKey key = AlertKey.of(insight);
        Instant now = clock.instant();
        AtomicBoolean promoted = new AtomicBoolean(false);
        lastPromoted.compute(key, (k, last) -> {
            if (last != null && Duration.between(last, now).compareTo(minInterval) < 0) {
                LOG.debug("Alert {} suppressed, cooldown active since {}", k, last);
                return last;
            }
            if (!qualifies(insight)) {
                return last;
            }
            promoted.set(true);
            return now;
        });
        return promoted.get();
    }

    private boolean qualifies(AggregatedInsight insight) {
        double confidence = insight.confidence();
        if (insight.category() == InsightCategory.FRAUD && confidence >= fraudThreshold) {
            return true;
        }
        if (insight.category() == InsightCategory.CONTRADICTION && confidence >= contradictionThreshold) {
            return true;
        }
        return insight.severity() == Severity.HIGH && confidence >= highSeverityThreshold;
    }

    /** Forgets every cooldown of the session; returns how many keys were dropped. */
    public int purgeSession(String sessionId) {
        int before = lastPromoted.size();
        lastPromoted.keySet().removeIf(k -> k.sessionId().equals(sessionId));
        return Math.max(0, before - lastPromoted.size());
    }

    // Visible for tests
    int trackedKeys() {
        return lastPromoted.size();
    }

    /**
     * Cooldown key; renders as {@code sessionId:category:insightType}.
     */
    record AlertKey(String sessionId, InsightCategory category, String insightType) {

        static AlertKey of(AggregatedInsight insight) {
            return new AlertKey(insight.sessionId(), insight.category(), insight.insightType());
        }

        @Override
        public String toString() {
            return sessionId + ":" + category.wireName() + ":" + insightType;
        }
    }
}

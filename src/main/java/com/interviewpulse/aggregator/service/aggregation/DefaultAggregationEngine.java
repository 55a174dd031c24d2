package com.interviewpulse.aggregator.service.aggregation;

import com.interviewpulse.aggregator.config.properties.AggregationProperties;
import com.interviewpulse.aggregator.domain.AggregatedInsight;
import com.interviewpulse.aggregator.domain.InsightBatch;
import com.interviewpulse.aggregator.domain.RawInsight;
import com.interviewpulse.aggregator.domain.Recommendation;
import com.interviewpulse.aggregator.service.alert.AlertGate;
import com.interviewpulse.aggregator.service.buffer.RoundBuffer;
import com.interviewpulse.aggregator.service.metrics.AggregationMetrics;
import com.interviewpulse.aggregator.service.recommendation.RecommendationGenerator;
import com.interviewpulse.aggregator.service.recommendation.SummaryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Default {@link AggregationEngine}: group, score, filter, sort, truncate, alert, recommend,
 * summarize.
 *
 * <p>Aggregation and {@link #clearSession(String)} for the same session run under a per-session
 * lock, so a clear never interleaves with an aggregation that already took its snapshot. Ingest
 * takes no lock. Sort keys are category priority
 * ascending, confidence descending, severity weight descending; {@link List#sort} is stable, so
 * remaining ties keep group order.
 */
public class DefaultAggregationEngine implements AggregationEngine {

    private static final Logger LOG = LogManager.getLogger(DefaultAggregationEngine.class);

    static final Comparator<AggregatedInsight> PRIORITY_ORDER =
            Comparator.<AggregatedInsight>comparingInt(i -> i.category().priority())
                    .thenComparing(Comparator.comparingDouble(AggregatedInsight::confidence).reversed())
                    .thenComparing(Comparator.<AggregatedInsight>comparingInt(i -> i.severity().weight()).reversed());

    private final RoundBuffer buffer;
    private final InsightGrouper grouper;
    private final InsightScorer scorer;
    private final InsightIdGenerator ids;
    private final AlertGate alertGate;
    private final RecommendationGenerator recommendations;
    private final SummaryBuilder summaries;
    private final AggregationProperties props;
    private final AggregationMetrics metrics;
    private final Clock clock;
    private final ConcurrentMap<String, Object> sessionLocks = new ConcurrentHashMap<>();

    public DefaultAggregationEngine(RoundBuffer buffer,
                                    InsightGrouper grouper,
                                    InsightScorer scorer,
                                    InsightIdGenerator ids,
                                    AlertGate alertGate,
                                    RecommendationGenerator recommendations,
                                    SummaryBuilder summaries,
                                    AggregationProperties props,
                                    AggregationMetrics metrics,
                                    Clock clock) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.grouper = Objects.requireNonNull(grouper, "grouper");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.ids = Objects.requireNonNull(ids, "ids");
        this.alertGate = Objects.requireNonNull(alertGate, "alertGate");
        this.recommendations = Objects.requireNonNull(recommendations, "recommendations");
        this.summaries = Objects.requireNonNull(summaries, "summaries");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public int addInsight(RawInsight insight) {
        Objects.requireNonNull(insight, "insight");
        int size = buffer.add(insight.sessionId(), insight);
        metrics.incrementIngested(insight.source());
        LOG.debug("Buffered {}/{} for session {} (buffer={})",
                insight.source(), insight.type(), insight.sessionId(), size);
        return size;
    }

    @Override
    public InsightBatch aggregate(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        long start = System.nanoTime();
        try {
            synchronized (lockFor(sessionId)) {
                return doAggregate(sessionId);
            }
        } finally {
            metrics.recordAggregationLatency(System.nanoTime() - start);
        }
    }

    private InsightBatch doAggregate(String sessionId) {
        List<RawInsight> snapshot = buffer.snapshot(sessionId);
        if (snapshot.isEmpty()) {
            return InsightBatch.empty(sessionId, clock.instant());
        }

        List<AggregatedInsight> scored = new ArrayList<>();
        for (Map.Entry<GroupKey, List<RawInsight>> group : grouper.group(snapshot).entrySet()) {
            scorer.score(sessionId, group.getKey(), group.getValue())
                    .filter(i -> i.confidence() >= props.getMinConfidenceThreshold())
                    .ifPresent(scored::add);
        }
        scored.sort(PRIORITY_ORDER);
        List<AggregatedInsight> top = scored.size() > props.getMaxInsightsPerBatch()
                ? scored.subList(0, props.getMaxInsightsPerBatch())
                : scored;

        List<AggregatedInsight> gated = new ArrayList<>(top.size());
        for (AggregatedInsight insight : top) {
            boolean alert = alertGate.shouldAlert(insight);
            if (alert) {
                metrics.incrementAlert(insight.category().wireName());
            }
            gated.add(insight.withAlert(alert));
        }

        List<Recommendation> recs = props.isGenerateRecommendations()
                ? recommendations.generate(gated, props.getMaxRecommendationsPerRound())
                : List.of();

        LOG.debug("Aggregated session {}: raw={}, groups scored={}, delivered={}, recommendations={}",
                sessionId, snapshot.size(), scored.size(), gated.size(), recs.size());
        return new InsightBatch(sessionId, gated, recs, summaries.build(gated), clock.instant());
    }

    @Override
    public int clearSession(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        int discarded;
        int cooldowns;
        synchronized (lockFor(sessionId)) {
            discarded = buffer.clear(sessionId);
            cooldowns = alertGate.purgeSession(sessionId);
            ids.reset(sessionId);
            sessionLocks.remove(sessionId);
        }
        LOG.info("Cleared session {}: {} buffered insight(s), {} alert cooldown(s)", sessionId, discarded, cooldowns);
        return discarded;
    }

    private Object lockFor(String sessionId) {
        return sessionLocks.computeIfAbsent(sessionId, k -> new Object());
    }

    @Override
    public int discardBuffered(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        return buffer.clear(sessionId);
    }

    @Override
    public int bufferSize(String sessionId) {
        return buffer.size(sessionId);
    }

    @Override
    public Set<String> activeSessions() {
        return buffer.activeSessions();
    }
}

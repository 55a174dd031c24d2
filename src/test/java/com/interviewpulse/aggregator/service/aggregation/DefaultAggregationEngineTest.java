package com.interviewpulse.aggregator.service.aggregation;

import com.interviewpulse.aggregator.config.properties.AggregationProperties;
import com.interviewpulse.aggregator.domain.AggregatedInsight;
import com.interviewpulse.aggregator.domain.InsightBatch;
import com.interviewpulse.aggregator.domain.InsightCategory;
import com.interviewpulse.aggregator.domain.RawInsight;
import com.interviewpulse.aggregator.domain.Recommendation;
import com.interviewpulse.aggregator.service.alert.AlertGate;
import com.interviewpulse.aggregator.service.buffer.RoundBuffer;
import com.interviewpulse.aggregator.service.metrics.AggregationMetrics;
import com.interviewpulse.aggregator.service.recommendation.RecommendationGenerator;
import com.interviewpulse.aggregator.service.recommendation.SummaryBuilder;
import com.interviewpulse.aggregator.testutil.MutableClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.interviewpulse.aggregator.testutil.Insights.declared;
import static com.interviewpulse.aggregator.testutil.Insights.raw;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DefaultAggregationEngineTest {

    private MutableClock clock;
    private MeterRegistry registry;
    private DefaultAggregationEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        registry = new SimpleMeterRegistry();
        engine = newEngine(AggregationProperties.defaults());
    }

    private DefaultAggregationEngine newEngine(AggregationProperties props) {
        return newEngine(props, new InsightGrouper());
    }

    private DefaultAggregationEngine newEngine(AggregationProperties props, InsightGrouper grouper) {
        InsightIdGenerator ids = new InsightIdGenerator();
        return new DefaultAggregationEngine(
                new RoundBuffer(props.retention(), clock),
                grouper,
                new InsightScorer(ids, props, clock),
                ids,
                new AlertGate(props, clock),
                new RecommendationGenerator(),
                new SummaryBuilder(),
                props,
                new AggregationMetrics(registry),
                clock);
    }

    private void ingestRoundOneScenario() {
        engine.addInsight(declared("r1", "fraud-detection", "fraud", "multiple_faces", 0.9));
        engine.addInsight(declared("r1", "video-analysis", "fraud", "multiple_faces", 0.95));
        engine.addInsight(raw("r1", "speech-analysis", "low_confidence", 0.4));
    }

    @Test
    void emptySessionYieldsEmptyBatch() {
        InsightBatch batch = engine.aggregate("nobody");

        assertThat(batch.isEmpty()).isTrue();
        assertThat(batch.summary().totalInsights()).isZero();
        assertThat(batch.recommendations()).isEmpty();
        assertThat(batch.sessionId()).isEqualTo("nobody");
    }

    @Test
    void fraudSeenByTwoServicesBecomesSingleAlertWithIdentityAction() {
        ingestRoundOneScenario();

        InsightBatch batch = engine.aggregate("r1");

        assertThat(batch.insights()).hasSize(1);
        AggregatedInsight fraud = batch.insights().get(0);
        assertThat(fraud.category()).isEqualTo(InsightCategory.FRAUD);
        assertThat(fraud.insightType()).isEqualTo("multiple_faces");
        assertThat(fraud.confidence()).isCloseTo(1.0, within(1e-9));
        assertThat(fraud.alert()).isTrue();
        assertThat(fraud.sourceServices()).containsExactlyInAnyOrder("fraud-detection", "video-analysis");

        assertThat(batch.recommendations()).hasSize(1);
        Recommendation rec = batch.recommendations().get(0);
        assertThat(rec.type()).isEqualTo(Recommendation.Type.ACTION);
        assertThat(rec.relatedInsightId()).isEqualTo(fraud.id());

        assertThat(batch.summary().totalInsights()).isEqualTo(1);
        assertThat(batch.summary().alertsCount()).isEqualTo(1);
    }

    @Test
    void withoutDeclaredCategoryServicesGroupSeparately() {
        engine.addInsight(raw("r1", "fraud-detection", "multiple_faces", 0.9));
        engine.addInsight(raw("r1", "video-analysis", "multiple_faces", 0.95));

        InsightBatch batch = engine.aggregate("r1");

        assertThat(batch.insights()).extracting(AggregatedInsight::category)
                .containsExactly(InsightCategory.FRAUD, InsightCategory.VIDEO);
    }

    @Test
    void dropsInsightsBelowConfidenceThreshold() {
        engine.addInsight(raw("r1", "speech-analysis", "low_confidence", 0.69));

        assertThat(engine.aggregate("r1").isEmpty()).isTrue();
    }

    @Test
    void ordersByCategoryPriorityThenConfidenceThenSeverity() {
        engine.addInsight(raw("r1", "video-analysis", "head_movement", 0.99));
        engine.addInsight(raw("r1", "speech-analysis", "high_hesitation", 0.75));
        engine.addInsight(raw("r1", "speech-analysis", "low_confidence", 0.9));
        engine.addInsight(raw("r1", "nlp-engine", "contradiction", 0.72));
        engine.addInsight(raw("r1", "fraud-detection", "face_switch", 0.71));
        engine.addInsight(raw("r1", "custom", "misc", 1.0));
        engine.addInsight(raw("r1", "fraud-detection", "background_voice",
                Map.of("confidence", 0.71, "severity", "high")));

        InsightBatch batch = engine.aggregate("r1");

        assertThat(batch.insights()).extracting(AggregatedInsight::insightType).containsExactly(
                "background_voice", "face_switch", "contradiction", "low_confidence",
                "high_hesitation", "head_movement", "misc");
    }

    @Test
    void truncatesToMaxInsightsPerBatch() {
        for (int i = 0; i < 15; i++) {
            engine.addInsight(raw("r1", "video-analysis", "type_" + i, 0.8));
        }

        assertThat(engine.aggregate("r1").insights()).hasSize(10);
    }

    @Test
    void aggregateIsRepeatableWithoutNewIngest() {
        ingestRoundOneScenario();
        engine.addInsight(raw("r1", "video-analysis", "head_movement", 0.9));

        InsightBatch first = engine.aggregate("r1");
        InsightBatch second = engine.aggregate("r1");

        assertThat(second.insights())
                .usingRecursiveFieldByFieldElementComparatorIgnoringFields("id", "alert", "timestamp")
                .containsExactlyElementsOf(first.insights());
        assertThat(engine.bufferSize("r1")).isEqualTo(4);
    }

    @Test
    void secondAggregateWithinCooldownDoesNotAlertAgain() {
        ingestRoundOneScenario();

        assertThat(engine.aggregate("r1").alerts()).hasSize(1);
        clock.advanceSeconds(30);
        InsightBatch again = engine.aggregate("r1");

        assertThat(again.insights()).hasSize(1);
        assertThat(again.alerts()).isEmpty();
        assertThat(again.recommendations()).isEmpty();
    }

    @Test
    void clearSessionResetsBufferCooldownAndIds() {
        ingestRoundOneScenario();
        engine.aggregate("r1");

        assertThat(engine.clearSession("r1")).isEqualTo(3);
        assertThat(engine.bufferSize("r1")).isZero();
        assertThat(engine.activeSessions()).doesNotContain("r1");

        ingestRoundOneScenario();
        InsightBatch afterRestart = engine.aggregate("r1");
        assertThat(afterRestart.alerts()).hasSize(1);
        assertThat(afterRestart.insights().get(0).id()).isEqualTo("r1-1");
    }

    @Test
    void clearWaitsForAggregationInProgress() throws Exception {
        CountDownLatch grouping = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean first = new AtomicBoolean(true);
        InsightGrouper pausing = new InsightGrouper() {
            @Override
            public Map<GroupKey, List<RawInsight>> group(List<RawInsight> records) {
                if (first.compareAndSet(true, false)) {
                    grouping.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return super.group(records);
            }
        };
        engine = newEngine(AggregationProperties.defaults(), pausing);
        ingestRoundOneScenario();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<InsightBatch> inFlight = pool.submit(() -> engine.aggregate("r1"));
            assertThat(grouping.await(5, TimeUnit.SECONDS)).isTrue();
            Future<Integer> clear = pool.submit(() -> engine.clearSession("r1"));

            release.countDown();
            assertThat(inFlight.get(5, TimeUnit.SECONDS).alerts()).hasSize(1);
            assertThat(clear.get(5, TimeUnit.SECONDS)).isEqualTo(3);
        } finally {
            pool.shutdownNow();
        }

        ingestRoundOneScenario();
        InsightBatch afterRestart = engine.aggregate("r1");
        assertThat(afterRestart.alerts()).hasSize(1);
        assertThat(afterRestart.insights().get(0).id()).isEqualTo("r1-1");
    }

    @Test
    void discardBufferedKeepsCooldown() {
        ingestRoundOneScenario();
        engine.aggregate("r1");

        engine.discardBuffered("r1");
        ingestRoundOneScenario();

        assertThat(engine.aggregate("r1").alerts()).isEmpty();
    }

    @Test
    void recommendationsCanBeDisabled() {
        engine = newEngine(new AggregationProperties(null, null, null, null, null, null,
                null, false, null, null, null, null));
        ingestRoundOneScenario();

        InsightBatch batch = engine.aggregate("r1");

        assertThat(batch.alerts()).hasSize(1);
        assertThat(batch.recommendations()).isEmpty();
    }

    @Test
    void recommendationsAreCapped() {
        engine = newEngine(new AggregationProperties(null, null, null, null, null, null,
                null, null, 2, null, null, null));
        for (String type : new String[] {"face_switch", "multiple_faces", "background_voice"}) {
            engine.addInsight(raw("r1", "fraud-detection", type, 0.95));
        }

        InsightBatch batch = engine.aggregate("r1");

        assertThat(batch.alerts()).hasSize(3);
        assertThat(batch.recommendations()).hasSize(2);
    }

    @Test
    void sessionsAreIndependent() {
        engine.addInsight(raw("a", "fraud-detection", "face_switch", 0.9));
        engine.addInsight(raw("b", "speech-analysis", "low_confidence", 0.8));

        assertThat(engine.aggregate("a").insights()).extracting(AggregatedInsight::sessionId).containsOnly("a");
        assertThat(engine.activeSessions()).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    void recordsMetrics() {
        ingestRoundOneScenario();
        engine.aggregate("r1");

        assertThat(registry.find("insights.aggregator.ingested").tag("source", "fraud-detection").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("insights.aggregator.alerts").tag("category", "fraud").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("insights.aggregator.aggregation.latency").timer().count()).isEqualTo(1);
    }
}

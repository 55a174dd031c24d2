package com.interviewpulse.aggregator.service.scheduling;

import com.interviewpulse.aggregator.config.properties.AggregationProperties;
import com.interviewpulse.aggregator.config.properties.DeliveryProperties;
import com.interviewpulse.aggregator.domain.AggregatedInsight;
import com.interviewpulse.aggregator.domain.InsightBatch;
import com.interviewpulse.aggregator.domain.InsightCategory;
import com.interviewpulse.aggregator.domain.Recommendation;
import com.interviewpulse.aggregator.domain.Severity;
import com.interviewpulse.aggregator.exception.DeliveryException;
import com.interviewpulse.aggregator.service.aggregation.AggregationEngine;
import com.interviewpulse.aggregator.service.aggregation.DefaultAggregationEngine;
import com.interviewpulse.aggregator.service.aggregation.InsightGrouper;
import com.interviewpulse.aggregator.service.aggregation.InsightIdGenerator;
import com.interviewpulse.aggregator.service.aggregation.InsightScorer;
import com.interviewpulse.aggregator.service.alert.AlertGate;
import com.interviewpulse.aggregator.service.buffer.RoundBuffer;
import com.interviewpulse.aggregator.service.delivery.BatchPublisher;
import com.interviewpulse.aggregator.service.metrics.AggregationMetrics;
import com.interviewpulse.aggregator.service.persistence.InsightStore;
import com.interviewpulse.aggregator.service.recommendation.RecommendationGenerator;
import com.interviewpulse.aggregator.service.recommendation.SummaryBuilder;
import com.interviewpulse.aggregator.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.interviewpulse.aggregator.testutil.Insights.aggregated;
import static com.interviewpulse.aggregator.testutil.Insights.raw;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AggregationSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private AggregationEngine engine;
    private BatchPublisher publisher;
    private InsightStore store;
    private SimpleMeterRegistry registry;
    private DeliveryProperties props;

    @BeforeEach
    void setUp() {
        engine = mock(AggregationEngine.class);
        publisher = mock(BatchPublisher.class);
        store = mock(InsightStore.class);
        registry = new SimpleMeterRegistry();
        props = new DeliveryProperties();
    }

    private AggregationScheduler scheduler() {
        return new AggregationScheduler(engine, publisher, store, new AggregationMetrics(registry), props,
                Duration.ofMillis(50), r -> { });
    }

    private void sessions(String... ids) {
        when(engine.activeSessions()).thenReturn(new LinkedHashSet<>(List.of(ids)));
    }

    private static InsightBatch batchWithAlert(String sessionId) {
        AggregatedInsight alert = aggregated(sessionId + "-1", InsightCategory.FRAUD, "face_switch", 0.9, Severity.HIGH)
                .withAlert(true);
        AggregatedInsight plain = aggregated(sessionId + "-2", InsightCategory.SPEECH, "pause", 0.75, Severity.LOW);
        Recommendation rec = new Recommendation(Recommendation.Type.ACTION, Recommendation.Priority.HIGH,
                "Verify identity", "d", List.of("Ask for ID"), List.of(), alert.id());
        return new InsightBatch(sessionId, List.of(alert, plain), List.of(rec), null, NOW);
    }

    @Test
    void deliversAndPersistsAlertsAndRecommendations() {
        sessions("r1");
        when(engine.bufferSize("r1")).thenReturn(3);
        InsightBatch batch = batchWithAlert("r1");
        when(engine.aggregate("r1")).thenReturn(batch);

        int delivered = scheduler().tick();

        assertThat(delivered).isEqualTo(1);
        verify(publisher).publishBatch("r1", batch);
        verify(store).persistInsight(batch.insights().get(0));
        verify(store, never()).persistInsight(batch.insights().get(1));
        verify(store).persistRecommendation("r1", batch.recommendations().get(0));
        verify(engine, never()).discardBuffered(anyString());
    }

    @Test
    void skipsEmptyBuffersAndEmptyBatches() {
        sessions("r1", "r2");
        when(engine.bufferSize("r1")).thenReturn(0);
        when(engine.bufferSize("r2")).thenReturn(2);
        when(engine.aggregate("r2")).thenReturn(InsightBatch.empty("r2", NOW));

        assertThat(scheduler().tick()).isZero();

        verify(engine, never()).aggregate("r1");
        verifyNoInteractions(publisher, store);
    }

    @Test
    void failureInOneSessionDoesNotStopOthers() {
        sessions("r1", "r2");
        when(engine.bufferSize(anyString())).thenReturn(1);
        when(engine.aggregate("r1")).thenThrow(new IllegalStateException("boom"));
        InsightBatch second = batchWithAlert("r2");
        when(engine.aggregate("r2")).thenReturn(second);

        assertThat(scheduler().tick()).isEqualTo(1);
        verify(publisher).publishBatch("r2", second);
    }

    @Test
    void deliveryFailureIsCountedAndStillPersists() {
        sessions("r1");
        when(engine.bufferSize("r1")).thenReturn(1);
        InsightBatch batch = batchWithAlert("r1");
        when(engine.aggregate("r1")).thenReturn(batch);
        doThrow(new DeliveryException("r1", "down", null)).when(publisher).publishBatch(eq("r1"), any());

        assertThat(scheduler().tick()).isZero();

        verify(store).persistInsight(batch.insights().get(0));
        verify(store).persistRecommendation("r1", batch.recommendations().get(0));
        assertThat(registry.find("insights.aggregator.delivery.failure").counter().count()).isEqualTo(1.0);
    }

    @Test
    void deliveryFailureKeepsBufferEvenWhenClearingAfterDelivery() {
        props.setClearAfterDelivery(true);
        sessions("r1");
        when(engine.bufferSize("r1")).thenReturn(1);
        when(engine.aggregate("r1")).thenReturn(batchWithAlert("r1"));
        doThrow(new DeliveryException("r1", "down", null)).when(publisher).publishBatch(eq("r1"), any());

        scheduler().tick();

        verify(engine, never()).discardBuffered(anyString());
    }

    @Test
    void alertFromRealEngineIsStoredWhenPublishFails() {
        MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        AggregationProperties aggregation = AggregationProperties.defaults();
        InsightIdGenerator ids = new InsightIdGenerator();
        AggregationMetrics metrics = new AggregationMetrics(registry);
        AggregationEngine real = new DefaultAggregationEngine(
                new RoundBuffer(aggregation.retention(), clock), new InsightGrouper(),
                new InsightScorer(ids, aggregation, clock), ids, new AlertGate(aggregation, clock),
                new RecommendationGenerator(), new SummaryBuilder(), aggregation, metrics, clock);
        real.addInsight(raw("r1", "fraud-detection", "face_switch", 0.95));
        doThrow(new DeliveryException("r1", "down", null)).when(publisher).publishBatch(anyString(), any());
        AggregationScheduler scheduler = new AggregationScheduler(real, publisher, store, metrics, props,
                Duration.ofMillis(50), r -> { });

        scheduler.tick();

        ArgumentCaptor<AggregatedInsight> stored = ArgumentCaptor.forClass(AggregatedInsight.class);
        verify(store).persistInsight(stored.capture());
        assertThat(stored.getValue().alert()).isTrue();
        assertThat(stored.getValue().insightType()).isEqualTo("face_switch");
        verify(store).persistRecommendation(eq("r1"), any(Recommendation.class));
    }

    @Test
    void clearAfterDeliveryDiscardsBuffer() {
        props.setClearAfterDelivery(true);
        sessions("r1");
        when(engine.bufferSize("r1")).thenReturn(1);
        when(engine.aggregate("r1")).thenReturn(batchWithAlert("r1"));

        scheduler().tick();

        verify(engine).discardBuffered("r1");
        verify(engine, never()).clearSession(anyString());
    }

    @Test
    void persistenceDisabledUsesNoopStore() {
        props.setPersistenceEnabled(false);
        sessions("r1");
        when(engine.bufferSize("r1")).thenReturn(1);
        when(engine.aggregate("r1")).thenReturn(batchWithAlert("r1"));

        scheduler().tick();

        verify(publisher).publishBatch(eq("r1"), any());
        verifyNoInteractions(store);
    }

    @Test
    void sessionIdIsInThreadContextDuringDeliveryOnly() {
        sessions("r1");
        when(engine.bufferSize("r1")).thenReturn(1);
        when(engine.aggregate("r1")).thenReturn(batchWithAlert("r1"));
        List<String> seen = new ArrayList<>();
        doAnswer(inv -> {
            seen.add(ThreadContext.get(AggregationScheduler.MDC_SESSION_ID));
            return null;
        }).when(publisher).publishBatch(anyString(), any());

        scheduler().tick();

        assertThat(seen).containsExactly("r1");
        assertThat(ThreadContext.get(AggregationScheduler.MDC_SESSION_ID)).isNull();
    }

    @Test
    void noSessionsMeansNoWork() {
        when(engine.activeSessions()).thenReturn(Set.of());

        assertThat(scheduler().tick()).isZero();
        verifyNoInteractions(publisher);
    }
}

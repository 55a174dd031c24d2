package com.interviewpulse.aggregator.service.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.interviewpulse.aggregator.domain.AggregatedInsight;
import com.interviewpulse.aggregator.domain.InsightCategory;
import com.interviewpulse.aggregator.domain.Recommendation;
import com.interviewpulse.aggregator.domain.Severity;
import com.interviewpulse.aggregator.service.metrics.AggregationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.interviewpulse.aggregator.testutil.Insights.aggregated;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JdbcInsightStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:05:00Z");

    private JdbcTemplate jdbc;
    private SimpleMeterRegistry registry;
    private JdbcInsightStore store;

    @BeforeEach
    void setUp() {
        jdbc = mock(JdbcTemplate.class);
        registry = new SimpleMeterRegistry();
        store = new JdbcInsightStore(jdbc, new ObjectMapper(), new AggregationMetrics(registry),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void insertsInsightRow() {
        AggregatedInsight insight = aggregated("r1-1", InsightCategory.FRAUD, "face_switch", 0.9, Severity.HIGH);

        store.persistInsight(insight);

        ArgumentCaptor<Object[]> args = ArgumentCaptor.forClass(Object[].class);
        verify(jdbc).update(eq(JdbcInsightStore.INSERT_INSIGHT), args.capture());
        Object[] row = args.getValue();
        assertThat(row).hasSize(8);
        assertThat(row[0]).isEqualTo("r1");
        assertThat(row[1]).isEqualTo("face_switch");
        assertThat(row[2]).isEqualTo("fraud");
        assertThat(row[3]).isEqualTo("high");
        assertThat(row[4]).isEqualTo(0.9);
        assertThat((String) row[5]).contains("\"title\":\"title\"", "\"followup_questions\":[]");
        assertThat(row[6]).isEqualTo("test");
        assertThat(row[7]).isEqualTo(Timestamp.from(insight.timestamp()));
    }

    @Test
    void insertsPendingRecommendationRow() {
        Recommendation rec = new Recommendation(Recommendation.Type.CLARIFICATION, Recommendation.Priority.MEDIUM,
                "Clarify", "d", List.of(), List.of("Can you walk me through it?"), "r1-2");

        store.persistRecommendation("r1", rec);

        ArgumentCaptor<Object[]> args = ArgumentCaptor.forClass(Object[].class);
        verify(jdbc).update(eq(JdbcInsightStore.INSERT_RECOMMENDATION), args.capture());
        Object[] row = args.getValue();
        assertThat(row[0]).isEqualTo("r1");
        assertThat(row[1]).isEqualTo("clarification");
        assertThat(row[2]).isEqualTo("medium");
        assertThat((String) row[3]).contains("\"related_insight_id\":\"r1-2\"");
        assertThat(row[4]).isEqualTo(JdbcInsightStore.STATUS_PENDING);
        assertThat(row[5]).isEqualTo(Timestamp.from(NOW));
    }

    @Test
    void storageFailuresAreCountedNotThrown() {
        when(jdbc.update(anyString(), any(Object[].class)))
                .thenThrow(new DataAccessResourceFailureException("db down"));
        AggregatedInsight insight = aggregated("r1-1", InsightCategory.FRAUD, "face_switch", 0.9, Severity.HIGH);
        Recommendation rec = new Recommendation(Recommendation.Type.ACTION, Recommendation.Priority.HIGH,
                "t", "d", List.of("a"), List.of(), "r1-1");

        assertThatCode(() -> {
            store.persistInsight(insight);
            store.persistRecommendation("r1", rec);
        }).doesNotThrowAnyException();

        assertThat(registry.find("insights.aggregator.persistence.failure").tag("kind", "insight")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.find("insights.aggregator.persistence.failure").tag("kind", "recommendation")
                .counter().count()).isEqualTo(1.0);
    }
}

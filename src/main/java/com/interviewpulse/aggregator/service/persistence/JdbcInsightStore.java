package com.interviewpulse.aggregator.service.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.interviewpulse.aggregator.domain.AggregatedInsight;
import com.interviewpulse.aggregator.domain.Recommendation;
import com.interviewpulse.aggregator.service.metrics.AggregationMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link InsightStore} writing to the {@code live_insights} and {@code ai_recommendations} tables.
 */
public class JdbcInsightStore implements InsightStore {

    private static final Logger LOG = LogManager.getLogger(JdbcInsightStore.class);

    static final String INSERT_INSIGHT = """
            INSERT INTO live_insights (
                round_id, insight_type, category, severity,
                confidence_score, content, source_service, created_at
            ) VALUES (?, ?, ?, ?, ?, CAST(? AS jsonb), ?, ?)
            """;

    static final String INSERT_RECOMMENDATION = """
            INSERT INTO ai_recommendations (
                round_id, recommendation_type, priority,
                content, status, created_at
            ) VALUES (?, ?, ?, CAST(? AS jsonb), ?, ?)
            """;

    static final String STATUS_PENDING = "pending";

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;
    private final AggregationMetrics metrics;
    private final Clock clock;

    public JdbcInsightStore(JdbcTemplate jdbc, ObjectMapper mapper, AggregationMetrics metrics, Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void persistInsight(AggregatedInsight insight) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("title", insight.title());
        content.put("description", insight.description());
        content.put("evidence", insight.evidence());
        content.put("followup_questions", insight.followupQuestions());
        try {
            jdbc.update(INSERT_INSIGHT,
                    insight.sessionId(),
                    insight.insightType(),
                    insight.category().wireName(),
                    insight.severity().wireName(),
                    insight.confidence(),
                    mapper.writeValueAsString(content),
                    String.join(",", insight.sourceServices()),
                    Timestamp.from(insight.timestamp()));
        } catch (DataAccessException | JsonProcessingException e) {
            LOG.error("Failed to persist insight {} for session {}: {}", insight.id(), insight.sessionId(), e.toString());
            metrics.incrementPersistenceFailure("insight");
        }
    }

    @Override
    public void persistRecommendation(String sessionId, Recommendation recommendation) {
        try {
            jdbc.update(INSERT_RECOMMENDATION,
                    sessionId,
                    recommendation.type().wireName(),
                    recommendation.priority().wireName(),
                    mapper.writeValueAsString(recommendation),
                    STATUS_PENDING,
                    Timestamp.from(clock.instant()));
        } catch (DataAccessException | JsonProcessingException e) {
            LOG.error("Failed to persist recommendation for insight {} (session {}): {}",
                    recommendation.relatedInsightId(), sessionId, e.toString());
            metrics.incrementPersistenceFailure("recommendation");
        }
    }
}

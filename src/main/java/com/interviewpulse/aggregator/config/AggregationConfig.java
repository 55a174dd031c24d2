package com.interviewpulse.aggregator.config;

import com.interviewpulse.aggregator.config.properties.AggregationProperties;
import com.interviewpulse.aggregator.service.aggregation.AggregationEngine;
import com.interviewpulse.aggregator.service.aggregation.DefaultAggregationEngine;
import com.interviewpulse.aggregator.service.aggregation.InsightGrouper;
import com.interviewpulse.aggregator.service.aggregation.InsightIdGenerator;
import com.interviewpulse.aggregator.service.aggregation.InsightScorer;
import com.interviewpulse.aggregator.service.alert.AlertGate;
import com.interviewpulse.aggregator.service.buffer.RoundBuffer;
import com.interviewpulse.aggregator.service.metrics.AggregationMetrics;
import com.interviewpulse.aggregator.service.recommendation.AssessmentGenerator;
import com.interviewpulse.aggregator.service.recommendation.RecommendationGenerator;
import com.interviewpulse.aggregator.service.recommendation.SummaryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the aggregation core explicitly. Every component is a plain object with
 * constructor-injected configuration; this class owns their single instances.
 */
@Configuration
public class AggregationConfig {

    private final AggregationProperties props;

    public AggregationConfig(AggregationProperties props) {
        this.props = props;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RoundBuffer roundBuffer(Clock clock) {
        return new RoundBuffer(props.retention(), clock);
    }

    @Bean
    public InsightIdGenerator insightIdGenerator() {
        return new InsightIdGenerator();
    }

    @Bean
    public InsightScorer insightScorer(InsightIdGenerator ids, Clock clock) {
        return new InsightScorer(ids, props, clock);
    }

    @Bean
    public AlertGate alertGate(Clock clock) {
        return new AlertGate(props, clock);
    }

    @Bean
    public RecommendationGenerator recommendationGenerator() {
        return new RecommendationGenerator();
    }

    @Bean
    public SummaryBuilder summaryBuilder() {
        return new SummaryBuilder();
    }

    @Bean
    public AssessmentGenerator assessmentGenerator(Clock clock) {
        return new AssessmentGenerator(clock);
    }

    @Bean
    public AggregationEngine aggregationEngine(RoundBuffer buffer,
                                               InsightScorer scorer,
                                               InsightIdGenerator ids,
                                               AlertGate alertGate,
                                               RecommendationGenerator recommendations,
                                               SummaryBuilder summaries,
                                               AggregationMetrics metrics,
                                               Clock clock) {
        return new DefaultAggregationEngine(buffer, new InsightGrouper(), scorer, ids, alertGate,
                recommendations, summaries, props, metrics, clock);
    }
}

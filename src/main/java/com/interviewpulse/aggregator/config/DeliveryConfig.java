package com.interviewpulse.aggregator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.interviewpulse.aggregator.config.properties.AggregationProperties;
import com.interviewpulse.aggregator.config.properties.DeliveryProperties;
import com.interviewpulse.aggregator.service.aggregation.AggregationEngine;
import com.interviewpulse.aggregator.service.delivery.BatchPublisher;
import com.interviewpulse.aggregator.service.delivery.RedisBatchPublisher;
import com.interviewpulse.aggregator.service.metrics.AggregationMetrics;
import com.interviewpulse.aggregator.service.persistence.InsightStore;
import com.interviewpulse.aggregator.service.persistence.JdbcInsightStore;
import com.interviewpulse.aggregator.service.scheduling.AggregationScheduler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the outbound side: Redis publisher, JDBC store and the periodic aggregation loop.
 */
@Configuration
public class DeliveryConfig {

    private final DeliveryProperties props;

    public DeliveryConfig(DeliveryProperties props) {
        this.props = props;
    }

    @Bean
    public BatchPublisher batchPublisher(StringRedisTemplate redis, ObjectMapper mapper) {
        return new RedisBatchPublisher(redis, mapper, props);
    }

    @Bean
    public InsightStore insightStore(JdbcTemplate jdbc, ObjectMapper mapper, AggregationMetrics metrics, Clock clock) {
        return new JdbcInsightStore(jdbc, mapper, metrics, clock);
    }

    @Bean
    public AggregationScheduler aggregationScheduler(AggregationEngine engine,
                                                     BatchPublisher publisher,
                                                     InsightStore store,
                                                     AggregationMetrics metrics,
                                                     AggregationProperties aggregationProps,
                                                     @Qualifier("aggregationExecutor") Executor executor) {
        return new AggregationScheduler(engine, publisher, store, metrics, props,
                aggregationProps.aggregationInterval(), executor);
    }
}

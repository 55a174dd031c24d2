package com.interviewpulse.aggregator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.interviewpulse.aggregator.config.properties.IngestProperties;
import com.interviewpulse.aggregator.service.aggregation.AggregationEngine;
import com.interviewpulse.aggregator.service.ingest.IngestScheduler;
import com.interviewpulse.aggregator.service.ingest.InsightFeed;
import com.interviewpulse.aggregator.service.ingest.InsightMessageParser;
import com.interviewpulse.aggregator.service.ingest.RedisStreamInsightFeed;
import com.interviewpulse.aggregator.service.metrics.AggregationMetrics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.concurrent.Executor;

/**
 * Wires the stream ingest path: Redis feed, message parser and the ingest loop.
 */
@Configuration
public class IngestConfig {

    private final IngestProperties props;

    public IngestConfig(IngestProperties props) {
        this.props = props;
    }

    @Bean
    public InsightFeed insightFeed(StringRedisTemplate redis) {
        return new RedisStreamInsightFeed(redis, props);
    }

    @Bean
    public InsightMessageParser insightMessageParser(ObjectMapper mapper) {
        return new InsightMessageParser(mapper, props.getPayloadField());
    }

    @Bean
    public IngestScheduler ingestScheduler(InsightFeed feed,
                                           InsightMessageParser parser,
                                           AggregationEngine engine,
                                           AggregationMetrics metrics,
                                           @Qualifier("ingestExecutor") Executor executor) {
        return new IngestScheduler(feed, parser, engine, metrics, props, executor);
    }
}

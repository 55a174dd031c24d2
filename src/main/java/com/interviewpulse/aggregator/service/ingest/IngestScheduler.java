package com.interviewpulse.aggregator.service.ingest;

import com.interviewpulse.aggregator.config.properties.IngestProperties;
import com.interviewpulse.aggregator.domain.RawInsight;
import com.interviewpulse.aggregator.exception.MalformedInsightException;
import com.interviewpulse.aggregator.service.aggregation.AggregationEngine;
import com.interviewpulse.aggregator.service.metrics.AggregationMetrics;
import com.interviewpulse.aggregator.service.scheduling.AbstractSchedulerLoop;
import com.interviewpulse.aggregator.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Long-running loop that moves raw insights from an {@link InsightFeed} into the engine.
 *
 * <p>Per message: parse, buffer, then acknowledge. Malformed messages are logged, counted and
 * acknowledged without retry. Any other failure leaves the message unacknowledged for feed-level
 * replay. A polled batch is always processed to the end before a stop request is honored.
 */
public class IngestScheduler extends AbstractSchedulerLoop {

    private static final Logger LOG = LogManager.getLogger(IngestScheduler.class);

    private final InsightFeed feed;
    private final InsightMessageParser parser;
    private final AggregationEngine engine;
    private final AggregationMetrics metrics;
    private final IngestProperties props;

    private boolean feedOpen;

    public IngestScheduler(InsightFeed feed,
                           InsightMessageParser parser,
                           AggregationEngine engine,
                           AggregationMetrics metrics,
                           IngestProperties props,
                           Executor executor) {
        super("ingest-scheduler", executor, props.errorBackoff(), props.isEnabled());
        this.feed = Objects.requireNonNull(feed, "feed");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.props = props;
    }

    @Override
    protected void runOnce() {
        if (!feedOpen) {
            feed.open();
            feedOpen = true;
        }
        List<FeedMessage> batch = feed.poll(props.pollTimeout());
        for (FeedMessage message : batch) {
            handle(message);
        }
    }

    /**
     * Processes one message.
     *
     * @return true when the message was acknowledged
     */
    boolean handle(FeedMessage message) {
        RawInsight insight;
        try {
            insight = parser.parse(message);
        } catch (MalformedInsightException e) {
            LOG.warn("Dropping message {} from {}: {} (payload: {})", message.messageId(), message.feed(),
                    e.getReason(), LogSanitizer.preview(message.fields().get(props.getPayloadField()),
                            LogSanitizer.PREVIEW_LENGTH));
            metrics.incrementDropped("malformed");
            feed.acknowledge(message);
            return true;
        }

        try {
            engine.addInsight(insight);
        } catch (RuntimeException e) {
            LOG.error("Failed to buffer message {} from {}; leaving it pending", message.messageId(), message.feed(), e);
            return false;
        }
        feed.acknowledge(message);
        LOG.debug("Buffered message {} from {} for session {}", message.messageId(), message.feed(), insight.sessionId());
        return true;
    }

    @Override
    protected void onExit() {
        feed.close();
        feedOpen = false;
    }

    @Override
    protected Duration shutdownTimeout() {
        return props.pollTimeout().plusSeconds(5);
    }
}

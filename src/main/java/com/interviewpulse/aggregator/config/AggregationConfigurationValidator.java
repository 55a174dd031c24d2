package com.interviewpulse.aggregator.config;

import com.interviewpulse.aggregator.config.properties.AggregationProperties;
import com.interviewpulse.aggregator.config.properties.IngestProperties;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Cross-property checks that single-field constraints cannot express. Runs at startup, before
 * any loop is started, and fails fast with actionable messages.
 */
@Component
class AggregationConfigurationValidator {

    private static final Logger LOG = LogManager.getLogger(AggregationConfigurationValidator.class);

    private final AggregationProperties aggregation;
    private final IngestProperties ingest;

    AggregationConfigurationValidator(AggregationProperties aggregation, IngestProperties ingest) {
        this.aggregation = aggregation;
        this.ingest = ingest;
    }

    @PostConstruct
    void validate() {
        if (aggregation.getWindowSeconds() < 2) {
            throw new IllegalArgumentException("insights.aggregation.window-seconds must be >= 2 so the "
                    + "aggregation interval (window / 2) is at least one second, got: "
                    + aggregation.getWindowSeconds());
        }
        Set<String> seen = new HashSet<>();
        for (String stream : ingest.getStreams()) {
            if (stream == null || stream.isBlank()) {
                throw new IllegalArgumentException("insights.ingest.streams must not contain blank entries");
            }
            if (!seen.add(stream)) {
                throw new IllegalArgumentException("insights.ingest.streams lists '" + stream + "' twice");
            }
        }
        if (aggregation.getFraudAlertConfidence() < aggregation.getMinConfidenceThreshold()) {
            LOG.warn("fraud-alert-confidence {} is below min-confidence-threshold {}; insights between "
                    + "the two are filtered out before they can alert",
                    aggregation.getFraudAlertConfidence(), aggregation.getMinConfidenceThreshold());
        }
    }
}

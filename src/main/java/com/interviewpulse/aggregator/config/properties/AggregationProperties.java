package com.interviewpulse.aggregator.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the aggregation engine and alert gate.
 *
 * <p>Every threshold is re-checked in the constructor so a bad value aborts startup
 * even when bean validation is not on the classpath.
 */
@Validated
@ConfigurationProperties(prefix = "insights.aggregation")
public class AggregationProperties {

    /** Trailing window in seconds; the buffer keeps records for twice this span. */
    @Positive
    private final int windowSeconds;

    /** Aggregated insights below this confidence are not delivered. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double minConfidenceThreshold;

    @Positive
    private final int maxInsightsPerBatch;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double fraudAlertConfidence;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double contradictionAlertConfidence;

    /** Confidence at which a high-severity insight of any category becomes an alert. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double highSeverityAlertConfidence;

    /** Cooldown between two alerts sharing (session, category, type). */
    @Min(0)
    private final int minAlertIntervalSeconds;

    private final boolean generateRecommendations;

    @Min(0)
    private final int maxRecommendationsPerRound;

    @Positive
    private final int maxEvidence;

    @Positive
    private final int maxFollowupQuestions;

    /** Multiplier applied to the mean confidence when more than one producer agrees. */
    @DecimalMin("1.0")
    private final double multiSourceBoost;

    @ConstructorBinding
    public AggregationProperties(Integer windowSeconds,
                                 Double minConfidenceThreshold,
                                 Integer maxInsightsPerBatch,
                                 Double fraudAlertConfidence,
                                 Double contradictionAlertConfidence,
                                 Double highSeverityAlertConfidence,
                                 Integer minAlertIntervalSeconds,
                                 Boolean generateRecommendations,
                                 Integer maxRecommendationsPerRound,
                                 Integer maxEvidence,
                                 Integer maxFollowupQuestions,
                                 Double multiSourceBoost) {
        this.windowSeconds = positive("window-seconds", windowSeconds == null ? 30 : windowSeconds);
        this.minConfidenceThreshold = unit("min-confidence-threshold",
                minConfidenceThreshold == null ? 0.7 : minConfidenceThreshold);
        this.maxInsightsPerBatch = positive("max-insights-per-batch",
                maxInsightsPerBatch == null ? 10 : maxInsightsPerBatch);
        this.fraudAlertConfidence = unit("fraud-alert-confidence",
                fraudAlertConfidence == null ? 0.85 : fraudAlertConfidence);
        this.contradictionAlertConfidence = unit("contradiction-alert-confidence",
                contradictionAlertConfidence == null ? 0.80 : contradictionAlertConfidence);
        this.highSeverityAlertConfidence = unit("high-severity-alert-confidence",
                highSeverityAlertConfidence == null ? 0.8 : highSeverityAlertConfidence);
        this.minAlertIntervalSeconds = nonNegative("min-alert-interval-seconds",
                minAlertIntervalSeconds == null ? 60 : minAlertIntervalSeconds);
        this.generateRecommendations = generateRecommendations == null || generateRecommendations;
        this.maxRecommendationsPerRound = nonNegative("max-recommendations-per-round",
                maxRecommendationsPerRound == null ? 5 : maxRecommendationsPerRound);
        this.maxEvidence = positive("max-evidence", maxEvidence == null ? 5 : maxEvidence);
        this.maxFollowupQuestions = positive("max-followup-questions",
                maxFollowupQuestions == null ? 3 : maxFollowupQuestions);
        double boost = multiSourceBoost == null ? 1.1 : multiSourceBoost;
        if (Double.isNaN(boost) || boost < 1.0) {
            throw new IllegalArgumentException("insights.aggregation.multi-source-boost must be >= 1.0, got: " + boost);
        }
        this.multiSourceBoost = boost;
    }

    /** All defaults; handy for tests and manual wiring. */
    public static AggregationProperties defaults() {
        return new AggregationProperties(null, null, null, null, null, null, null, null, null, null, null, null);
    }

    private static int positive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("insights.aggregation." + name + " must be positive, got: " + value);
        }
        return value;
    }

    private static int nonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException("insights.aggregation." + name + " must be >= 0, got: " + value);
        }
        return value;
    }

    private static double unit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("insights.aggregation." + name + " must be in [0,1], got: " + value);
        }
        return value;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public double getMinConfidenceThreshold() {
        return minConfidenceThreshold;
    }

    public int getMaxInsightsPerBatch() {
        return maxInsightsPerBatch;
    }

    public double getFraudAlertConfidence() {
        return fraudAlertConfidence;
    }

    public double getContradictionAlertConfidence() {
        return contradictionAlertConfidence;
    }

    public double getHighSeverityAlertConfidence() {
        return highSeverityAlertConfidence;
    }

    public int getMinAlertIntervalSeconds() {
        return minAlertIntervalSeconds;
    }

    public boolean isGenerateRecommendations() {
        return generateRecommendations;
    }

    public int getMaxRecommendationsPerRound() {
        return maxRecommendationsPerRound;
    }

    public int getMaxEvidence() {
        return maxEvidence;
    }

    public int getMaxFollowupQuestions() {
        return maxFollowupQuestions;
    }

    public double getMultiSourceBoost() {
        return multiSourceBoost;
    }

    /** How long the buffer retains a record: twice the window. */
    public Duration retention() {
        return Duration.ofSeconds(2L * windowSeconds);
    }

    /** Sleep between two periodic aggregation ticks: half the window. */
    public Duration aggregationInterval() {
        return Duration.ofMillis(windowSeconds * 1000L / 2);
    }

    public Duration minAlertInterval() {
        return Duration.ofSeconds(minAlertIntervalSeconds);
    }
}

package com.interviewpulse.aggregator.service.recommendation;

import com.interviewpulse.aggregator.domain.AggregatedInsight;
import com.interviewpulse.aggregator.domain.InsightBatch;
import com.interviewpulse.aggregator.domain.InsightCategory;
import com.interviewpulse.aggregator.domain.OverallAssessment;
import com.interviewpulse.aggregator.domain.Severity;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Derives an interview-so-far risk assessment from an aggregated batch.
 *
 * <p>Risk is high with two or more fraud alerts, medium with exactly one fraud alert or at least
 * two contradiction alerts, low otherwise.
 */
public class AssessmentGenerator {

    static final String HIGH_RISK = "Multiple fraud indicators detected. Strong recommendation to verify identity.";
    static final String MEDIUM_RISK = "Some concerns detected. Consider probing specific areas.";
    static final String LOW_RISK = "No significant concerns detected so far.";

    static final String VERIFY_IDENTITY = "Verify candidate identity before proceeding";
    static final String CLARIFY_CLAIMS = "Clarify discrepancies in experience claims";
    static final String CONTINUE = "Continue with planned interview questions";

    private final Clock clock;

    public AssessmentGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public OverallAssessment assess(InsightBatch batch, int durationMinutes) {
        Objects.requireNonNull(batch, "batch");
        if (durationMinutes < 0) {
            throw new IllegalArgumentException("durationMinutes must be >= 0, got: " + durationMinutes);
        }
        int fraudAlerts = countAlerts(batch.insights(), InsightCategory.FRAUD);
        int contradictions = countAlerts(batch.insights(), InsightCategory.CONTRADICTION);

        Severity risk;
        String explanation;
        if (fraudAlerts >= 2) {
            risk = Severity.HIGH;
            explanation = HIGH_RISK;
        } else if (fraudAlerts == 1 || contradictions >= 2) {
            risk = Severity.MEDIUM;
            explanation = MEDIUM_RISK;
        } else {
            risk = Severity.LOW;
            explanation = LOW_RISK;
        }

        List<String> nextSteps = new ArrayList<>(2);
        if (fraudAlerts > 0) {
            nextSteps.add(VERIFY_IDENTITY);
        }
        if (contradictions > 0) {
            nextSteps.add(CLARIFY_CLAIMS);
        }
        if (nextSteps.isEmpty()) {
            nextSteps.add(CONTINUE);
        }

        return new OverallAssessment(batch.sessionId(), durationMinutes, risk, explanation,
                fraudAlerts, contradictions, batch.insights().size(), nextSteps, clock.instant());
    }

    private static int countAlerts(List<AggregatedInsight> insights, InsightCategory category) {
        int n = 0;
        for (AggregatedInsight i : insights) {
            if (i.alert() && i.category() == category) {
                n++;
            }
        }
        return n;
    }
}

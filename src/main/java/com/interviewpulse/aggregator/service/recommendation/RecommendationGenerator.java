package com.interviewpulse.aggregator.service.recommendation;

import com.interviewpulse.aggregator.domain.AggregatedInsight;
import com.interviewpulse.aggregator.domain.InsightCategory;
import com.interviewpulse.aggregator.domain.Recommendation;
import com.interviewpulse.aggregator.domain.Recommendation.Priority;
import com.interviewpulse.aggregator.domain.Recommendation.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps alerted insights to interviewer-facing suggestions.
 *
 * <p>Fraud yields a high-priority identity check, contradiction a medium-priority clarification
 * seeded with the insight's follow-up questions, and speech hesitation a low-priority observation.
 * Other alerts produce nothing.
 */
public class RecommendationGenerator {

    static final List<String> IDENTITY_ACTIONS = List.of(
            "Ask the candidate to show their ID",
            "Request they pan the camera around the room",
            "Ask a question only they would know from their application");

    static final List<String> FALLBACK_QUESTIONS = List.of(
            "Can you elaborate on that?",
            "Can you walk me through a specific example?");

    static final List<String> HESITATION_ACTIONS = List.of(
            "Consider asking for more specific examples",
            "Give the candidate time to think before answering");

    private static final String HIGH_HESITATION = "high_hesitation";

    /**
     * @param insights batch insights in priority order; non-alerts are skipped
     * @param limit maximum number of recommendations returned
     */
    public List<Recommendation> generate(List<AggregatedInsight> insights, int limit) {
        List<Recommendation> out = new ArrayList<>();
        for (AggregatedInsight insight : insights) {
            if (out.size() >= limit) {
                break;
            }
            if (insight.alert()) {
                forInsight(insight).ifPresent(out::add);
            }
        }
        return List.copyOf(out);
    }

    Optional<Recommendation> forInsight(AggregatedInsight insight) {
        InsightCategory category = insight.category();
        if (category == InsightCategory.FRAUD) {
            return Optional.of(new Recommendation(
                    Type.ACTION,
                    Priority.HIGH,
                    "Verify Candidate Identity",
                    "Based on " + insight.insightType() + ", consider verifying the candidate's identity.",
                    IDENTITY_ACTIONS,
                    List.of(),
                    insight.id()));
        }
        if (category == InsightCategory.CONTRADICTION) {
            List<String> questions = insight.followupQuestions().isEmpty()
                    ? FALLBACK_QUESTIONS
                    : insight.followupQuestions();
            return Optional.of(new Recommendation(
                    Type.CLARIFICATION,
                    Priority.MEDIUM,
                    "Clarify Resume Claim",
                    insight.description(),
                    List.of(),
                    questions,
                    insight.id()));
        }
        if (category == InsightCategory.SPEECH && HIGH_HESITATION.equals(insight.insightType())) {
            return Optional.of(new Recommendation(
                    Type.OBSERVATION,
                    Priority.LOW,
                    "Candidate Hesitation Noted",
                    "The candidate appears hesitant. This could indicate uncertainty or nervousness.",
                    HESITATION_ACTIONS,
                    List.of(),
                    insight.id()));
        }
        return Optional.empty();
    }
}

package com.interviewpulse.aggregator.service.aggregation;

import com.interviewpulse.aggregator.config.properties.AggregationProperties;
import com.interviewpulse.aggregator.domain.AggregatedInsight;
import com.interviewpulse.aggregator.domain.InsightData;
import com.interviewpulse.aggregator.domain.RawInsight;
import com.interviewpulse.aggregator.domain.Severity;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Synthesizes one {@link AggregatedInsight} from a group of raw insights sharing (category, type).
 *
 * <p>Scoring rules:
 * <ul>
 *   <li>confidence: arithmetic mean of the reported confidences (0.5 when absent), multiplied by the
 *       multi-source boost when more than one distinct producer contributed, clamped to [0,1]</li>
 *   <li>severity: mean of the severity weights mapped back through
 *       {@link Severity#fromAverageWeight(double)}</li>
 *   <li>evidence and follow-up questions: de-duplicated in first-seen order, then capped</li>
 * </ul>
 *
 * <p>The alert flag is left unset; {@code AlertGate} decides it.
 */
public class InsightScorer {

    private final InsightIdGenerator ids;
    private final Clock clock;
    private final double multiSourceBoost;
    private final int maxEvidence;
    private final int maxFollowupQuestions;

    public InsightScorer(InsightIdGenerator ids, AggregationProperties props, Clock clock) {
        this.ids = Objects.requireNonNull(ids, "ids");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(props, "props");
        this.multiSourceBoost = props.getMultiSourceBoost();
        this.maxEvidence = props.getMaxEvidence();
        this.maxFollowupQuestions = props.getMaxFollowupQuestions();
    }

    /**
     * Scores a group. Returns empty for an empty group; otherwise consumes one id of the session.
     */
    public Optional<AggregatedInsight> score(String sessionId, GroupKey key, List<RawInsight> group) {
        if (group == null || group.isEmpty()) {
            return Optional.empty();
        }

        double confidenceSum = 0.0;
        int severitySum = 0;
        Set<String> sources = new LinkedHashSet<>();
        Set<String> evidence = new LinkedHashSet<>();
        Set<String> questions = new LinkedHashSet<>();
        String ownDescription = null;

        for (RawInsight record : group) {
            InsightData data = record.data();
            confidenceSum += data.confidence();
            severitySum += data.severity().weight();
            sources.add(record.source());
            Optional<String> description = data.description();
            if (description.isPresent()) {
                evidence.add(description.get());
                if (ownDescription == null) {
                    ownDescription = description.get();
                }
            }
            evidence.addAll(data.evidence());
            questions.addAll(data.followupQuestions());
        }

        double confidence = confidenceSum / group.size();
        if (sources.size() > 1) {
            confidence = confidence * multiSourceBoost;
        }
        confidence = clamp(confidence);

        Severity severity = Severity.fromAverageWeight((double) severitySum / group.size());
        String description = ownDescription != null
                ? ownDescription
                : InsightTemplates.description(key.category(), key.type());

        return Optional.of(new AggregatedInsight(
                ids.nextId(sessionId),
                sessionId,
                key.category(),
                key.type(),
                confidence,
                severity,
                InsightTemplates.title(key.category(), key.type()),
                description,
                firstN(evidence, maxEvidence),
                List.copyOf(sources),
                firstN(questions, maxFollowupQuestions),
                false,
                clock.instant()));
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }

    private static List<String> firstN(Set<String> values, int limit) {
        List<String> out = new ArrayList<>(Math.min(values.size(), limit));
        for (String v : values) {
            if (out.size() == limit) {
                break;
            }
            out.add(v);
        }
        return out;
    }
}

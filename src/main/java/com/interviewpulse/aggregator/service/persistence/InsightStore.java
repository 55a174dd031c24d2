package com.interviewpulse.aggregator.service.persistence;

import com.interviewpulse.aggregator.domain.AggregatedInsight;
import com.interviewpulse.aggregator.domain.Recommendation;

/**
 * Fire-and-forget persistence of alerts and recommendations.
 *
 * <p>Implementations log and swallow storage failures; callers never see them.
 */
public interface InsightStore {

    /** Store that discards everything; used when persistence is disabled. */
    InsightStore NOOP = new InsightStore() {
        @Override
        public void persistInsight(AggregatedInsight insight) {
        }

        @Override
        public void persistRecommendation(String sessionId, Recommendation recommendation) {
        }
    };

    void persistInsight(AggregatedInsight insight);

    void persistRecommendation(String sessionId, Recommendation recommendation);
}

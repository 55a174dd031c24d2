package com.interviewpulse.aggregator.service.aggregation;

import com.interviewpulse.aggregator.domain.InsightCategory;

import java.util.Objects;

/**
 * Composite (category, type) key raw insights are grouped under.
 */
public record GroupKey(InsightCategory category, String type) {

    public GroupKey {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(type, "type");
    }

    @Override
    public String toString() {
        return category.wireName() + ":" + type;
    }
}

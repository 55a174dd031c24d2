package com.interviewpulse.aggregator.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Producer-specific payload of a raw insight with typed, defaulting accessors.
 *
 * <p>The underlying map is copied on construction and never exposed mutably. Defaults:
 * <ul>
 *   <li>{@code confidence}: 0.5 when absent or not numeric</li>
 *   <li>{@code severity}: {@link Severity#LOW} when absent or unknown</li>
 *   <li>{@code evidence}, {@code followup_questions}: empty list when absent</li>
 * </ul>
 */
public final class InsightData {

    public static final String CONFIDENCE = "confidence";
    public static final String SEVERITY = "severity";
    public static final String DESCRIPTION = "description";
    public static final String EVIDENCE = "evidence";
    public static final String FOLLOWUP_QUESTIONS = "followup_questions";
    public static final String CATEGORY = "category";

    static final double DEFAULT_CONFIDENCE = 0.5;

    private static final InsightData EMPTY = new InsightData(Map.of());

    private final Map<String, Object> values;

    private InsightData(Map<String, Object> values) {
        this.values = values;
    }

    @JsonCreator
    public static InsightData of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        // LinkedHashMap keeps producer field order and tolerates null values
        return new InsightData(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static InsightData empty() {
        return EMPTY;
    }

    public double confidence() {
        Object raw = values.get(CONFIDENCE);
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            return Double.isNaN(d) ? DEFAULT_CONFIDENCE : d;
        }
        if (raw instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException ignored) {
                return DEFAULT_CONFIDENCE;
            }
        }
        return DEFAULT_CONFIDENCE;
    }

    /** Category the producer declared for this record, if it names a known one. */
    public Optional<InsightCategory> declaredCategory() {
        Object raw = values.get(CATEGORY);
        return raw instanceof String s ? InsightCategory.fromWire(s) : Optional.empty();
    }

    public Severity severity() {
        return Severity.fromWire(values.get(SEVERITY));
    }

    /** Producer description, if present and not blank. */
    public Optional<String> description() {
        Object raw = values.get(DESCRIPTION);
        if (raw instanceof String s && !s.isBlank()) {
            return Optional.of(s);
        }
        return Optional.empty();
    }

    public List<String> evidence() {
        return stringList(EVIDENCE);
    }

    public List<String> followupQuestions() {
        return stringList(FOLLOWUP_QUESTIONS);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    private List<String> stringList(String key) {
        Object raw = values.get(key);
        if (raw instanceof Collection<?> items) {
            List<String> out = new ArrayList<>(items.size());
            for (Object item : items) {
                if (item != null) {
                    out.add(item.toString());
                }
            }
            return List.copyOf(out);
        }
        if (raw instanceof String single && !single.isBlank()) {
            return List.of(single);
        }
        return List.of();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof InsightData other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "InsightData" + values;
    }
}

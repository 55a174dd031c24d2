package com.interviewpulse.aggregator.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Reported or aggregated severity of an insight.
 */
public enum Severity {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3);

    private final String wireName;
    private final int weight;

    Severity(String wireName, int weight) {
        this.wireName = wireName;
        this.weight = weight;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int weight() {
        return weight;
    }

    /**
     * Parses a producer-reported severity. Missing or unrecognised values count as {@link #LOW}.
     */
    public static Severity fromWire(Object value) {
        if (value == null) {
            return LOW;
        }
        String normalized = value.toString().trim().toLowerCase(Locale.ROOT);
        for (Severity s : values()) {
            if (s.wireName.equals(normalized)) {
                return s;
            }
        }
        return LOW;
    }

    /**
     * Maps an average weight back to a severity: {@code >= 2.5} high, {@code >= 1.5} medium, else low.
     */
    public static Severity fromAverageWeight(double averageWeight) {
        if (averageWeight >= 2.5) {
            return HIGH;
        }
        if (averageWeight >= 1.5) {
            return MEDIUM;
        }
        return LOW;
    }
}

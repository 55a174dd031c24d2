package com.interviewpulse.aggregator.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed set of insight categories. Each upstream producer maps to exactly one category;
 * the category also decides delivery priority (lower value = delivered first).
 */
public enum InsightCategory {
    FRAUD("fraud", 1),
    CONTRADICTION("contradiction", 2),
    SPEECH("speech", 3),
    VIDEO("video", 4),
    OTHER("other", 99);

    private static final Map<String, InsightCategory> BY_SOURCE = Map.of(
            "speech-analysis", SPEECH,
            "video-analysis", VIDEO,
            "fraud-detection", FRAUD,
            "nlp-engine", CONTRADICTION
    );

    private final String wireName;
    private final int priority;

    InsightCategory(String wireName, int priority) {
        this.wireName = wireName;
        this.priority = priority;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int priority() {
        return priority;
    }

    /**
     * Maps a producer id (e.g. {@code fraud-detection}) to its category.
     * Unknown or null producers land in {@link #OTHER}.
     */
    public static InsightCategory fromSource(String source) {
        if (source == null) {
            return OTHER;
        }
        return BY_SOURCE.getOrDefault(source.trim().toLowerCase(Locale.ROOT), OTHER);
    }

    /**
     * Resolves a category by its wire name ({@code fraud}, {@code video}, ...), ignoring case.
     */
    public static Optional<InsightCategory> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (InsightCategory c : values()) {
            if (c.wireName.equals(normalized)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    /** Human-formatted name, e.g. {@code Fraud}. */
    public String displayName() {
        return Character.toUpperCase(wireName.charAt(0)) + wireName.substring(1);
    }
}

package com.interviewpulse.aggregator.service.aggregation;

import com.interviewpulse.aggregator.domain.InsightCategory;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Interviewer-facing titles and descriptions for the known (category, type) pairs.
 *
 * <p>Unknown pairs fall back to {@code "{Category}: {Type Words}"} for the title and
 * {@code "Observation in {category}: {type}"} for the description.
 */
final class InsightTemplates {

    private static final Map<String, String> TITLES = Map.of(
            "fraud:multiple_faces", "Multiple Faces Detected",
            "fraud:face_switch", "Face Switch Detected",
            "fraud:background_voice", "Background Voice Detected",
            "contradiction:contradiction", "Resume Contradiction Found",
            "contradiction:skill_mismatch", "Skill Level Mismatch",
            "speech:low_confidence", "Low Speaking Confidence",
            "speech:high_hesitation", "High Hesitation Detected",
            "video:head_movement", "Unusual Head Movement",
            "video:low_quality", "Video Quality Issue"
    );

    private static final Map<String, String> DESCRIPTIONS = Map.of(
            "fraud:multiple_faces", "Multiple people detected in the candidate's video feed. "
                    + "This may indicate someone else is present during the interview.",
            "fraud:face_switch", "The face in the video appears to have changed from the original candidate. "
                    + "Identity verification recommended.",
            "fraud:background_voice", "Additional voices detected in the audio that may indicate coaching or assistance.",
            "contradiction:contradiction", "The candidate's statement contradicts information on their resume.",
            "contradiction:skill_mismatch", "The candidate's demonstrated knowledge doesn't match the expertise level "
                    + "claimed on their resume.",
            "speech:low_confidence", "Speech analysis indicates the candidate may be uncertain about their response.",
            "speech:high_hesitation", "Frequent pauses and filler words detected in the candidate's response.",
            "video:head_movement", "Candidate is looking away from the camera frequently.",
            "video:low_quality", "Video quality is degraded, which may affect analysis accuracy."
    );

    private InsightTemplates() {
    }

    static String title(InsightCategory category, String type) {
        String title = TITLES.get(key(category, type));
        return title != null ? title : category.displayName() + ": " + humanize(type);
    }

    static String description(InsightCategory category, String type) {
        String description = DESCRIPTIONS.get(key(category, type));
        return description != null ? description : "Observation in " + category.wireName() + ": " + type;
    }

    /** {@code high_hesitation} -> {@code High Hesitation}. */
    static String humanize(String type) {
        return Arrays.stream(type.split("_"))
                .filter(w -> !w.isEmpty())
                .map(w -> Character.toUpperCase(w.charAt(0)) + w.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }

    private static String key(InsightCategory category, String type) {
        return category.wireName() + ":" + type;
    }
}

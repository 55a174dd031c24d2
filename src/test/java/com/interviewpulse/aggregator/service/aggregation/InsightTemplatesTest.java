package com.interviewpulse.aggregator.service.aggregation;

import com.interviewpulse.aggregator.domain.InsightCategory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InsightTemplatesTest {

    @Test
    void humanizesSnakeCase() {
        assertThat(InsightTemplates.humanize("high_hesitation")).isEqualTo("High Hesitation");
        assertThat(InsightTemplates.humanize("LOW__quality")).isEqualTo("Low Quality");
        assertThat(InsightTemplates.humanize("single")).isEqualTo("Single");
    }

    @Test
    void knownPairsHaveTitles() {
        assertThat(InsightTemplates.title(InsightCategory.SPEECH, "high_hesitation")).isEqualTo("High Hesitation Detected");
        assertThat(InsightTemplates.title(InsightCategory.CONTRADICTION, "skill_mismatch")).isEqualTo("Skill Level Mismatch");
    }

    @Test
    void templateLookupIsCategorySpecific() {
        // same type under another category is not a known pair
        assertThat(InsightTemplates.title(InsightCategory.VIDEO, "multiple_faces")).isEqualTo("Video: Multiple Faces");
    }
}

package com.careline.checkin.guidance;

import com.careline.checkin.model.GuidanceTip;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GuidanceProviderTest {

    private final GuidanceProvider provider = new GuidanceProvider();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "cramps, cramps_hydration, Muscle cramps",
        "nausea, nausea_small_meals, Nausea",
        "dizziness, dizziness_sit, Dizziness",
        "shortness_of_breath, sob_escalate, Shortness of breath",
        "swelling, swelling_track, Swelling",
        "headache, headache_rest, Headache",
        "access_site, access_redness, Access site issues",
        "fatigue, fatigue_pace, Fatigue",
        "fever_chills, fever_chills, Fever or chills"
    })
    @DisplayName("Each symptom category maps to its tip")
    void testSymptomCategory(String category, String tipId, String title) {
        List<GuidanceTip> tips = provider.tips(List.of(category), List.of());

        assertThat(tips).singleElement().satisfies(tip -> {
            assertThat(tip.getId()).isEqualTo(tipId);
            assertThat(tip.getTitle()).isEqualTo(title);
        });
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "diet_fluids, diet_fluids",
        "medications, medications",
        "emotional_support, emotional_support",
        "access_care, access_redness"
    })
    @DisplayName("Concern categories map to their tips")
    void testConcernCategory(String category, String tipId) {
        assertThat(provider.tips(List.of(), List.of(category)))
            .extracting(GuidanceTip::getId)
            .containsExactly(tipId);
    }

    @Test
    @DisplayName("Tips come back in library order without duplicates")
    void testLibraryOrderAndDeduplication() {
        List<GuidanceTip> tips = provider.tips(
            List.of("fatigue", "access_site", "cramps"),
            List.of("access_care", "medications"));

        assertThat(tips)
            .extracting(GuidanceTip::getId)
            .containsExactly("cramps_hydration", "access_redness", "fatigue_pace", "medications");
    }

    @Test
    @DisplayName("Unmatched or missing categories yield no tips")
    void testNoMatch() {
        assertThat(provider.tips(List.of("other"), List.of("schedule_transport", "financial_insurance"))).isEmpty();
        assertThat(provider.tips(List.of(), List.of())).isEmpty();
        assertThat(provider.tips(null, null)).isEmpty();
    }
}

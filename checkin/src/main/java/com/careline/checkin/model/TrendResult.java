package com.careline.checkin.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Trend datasets for one subject over one window. Series are chronological.
 */
@Value
@Builder
@Schema(description = "Check-in trends for a subject over a time window")
public class TrendResult {

    List<PainPoint> painSeries;

    Map<EnergyBucket, Integer> energyDistribution;

    Map<MoodBucket, Integer> moodDistribution;

    Map<Daypart, Integer> daypartDistribution;

    @Schema(description = "Every symptom category seen in the window, ranked by count")
    List<CategoryCount> symptomCategoryTotals;

    @Schema(description = "Daily counts for the top ranked symptom categories, in rank order")
    Map<String, List<DailyCount>> symptomCategoryDaily;

    List<CategoryCount> concernCategoryTotals;

    int totalRecordsInWindow;

    Instant windowStart;

    Instant windowEnd;

    ZoneId zone;
}

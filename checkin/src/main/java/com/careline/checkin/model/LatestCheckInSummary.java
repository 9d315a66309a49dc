package com.careline.checkin.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * The newest check-in's fields for a subject, derived from history on every call.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LatestCheckInSummary {
    String subjectId;
    Instant lastCheckInAt;
    Integer painLevel;
    EnergyBucket energyBucket;
    MoodBucket moodBucket;
    String symptoms;
    String concerns;
    String teamNote;
    long recordCount;

    /**
     * @param newest      newest-first history; only the first record is read
     * @param recordCount total check-ins stored for the subject
     */
    public static LatestCheckInSummary from(String subjectId, List<CheckInRecord> newest, long recordCount) {
        if (newest == null || newest.isEmpty()) {
            return LatestCheckInSummary.builder()
                .subjectId(subjectId)
                .recordCount(0)
                .build();
        }
        CheckInRecord latest = newest.get(0);
        return LatestCheckInSummary.builder()
            .subjectId(subjectId)
            .lastCheckInAt(latest.getCreatedAt())
            .painLevel(latest.getPainLevel())
            .energyBucket(latest.getEnergyBucket())
            .moodBucket(latest.getMoodBucket())
            .symptoms(latest.getSymptoms())
            .concerns(latest.getConcerns())
            .teamNote(latest.getTeamNote())
            .recordCount(recordCount)
            .build();
    }
}

package com.careline.checkin.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LatestCheckInSummaryTest {

    @Test
    @DisplayName("Summary reflects the newest record and the stored count")
    void testFromHistory() {
        CheckInRecord newest = CheckInRecord.builder()
            .checkInId("c-2").subjectId("s-001")
            .createdAt(Instant.parse("2025-08-02T09:00:00Z"))
            .painLevel(6).moodBucket(MoodBucket.SAD).energyBucket(EnergyBucket.LOW)
            .teamNote("please call")
            .build();
        CheckInRecord older = CheckInRecord.builder()
            .checkInId("c-1").subjectId("s-001")
            .createdAt(Instant.parse("2025-08-01T09:00:00Z"))
            .painLevel(2)
            .build();

        LatestCheckInSummary summary = LatestCheckInSummary.from("s-001", List.of(newest, older), 7);

        assertThat(summary.getLastCheckInAt()).isEqualTo(newest.getCreatedAt());
        assertThat(summary.getPainLevel()).isEqualTo(6);
        assertThat(summary.getMoodBucket()).isEqualTo(MoodBucket.SAD);
        assertThat(summary.getTeamNote()).isEqualTo("please call");
        assertThat(summary.getRecordCount()).isEqualTo(7);
    }

    @Test
    @DisplayName("Empty history yields a summary with no latest fields")
    void testEmptyHistory() {
        LatestCheckInSummary summary = LatestCheckInSummary.from("s-001", List.of(), 0);

        assertThat(summary.getSubjectId()).isEqualTo("s-001");
        assertThat(summary.getLastCheckInAt()).isNull();
        assertThat(summary.getRecordCount()).isZero();
    }

    @Test
    @DisplayName("Bucket ranks survive the entity round trip")
    void testEntityRanks() {
        CheckInRecord record = CheckInRecord.builder()
            .checkInId("c-9").subjectId("s-001")
            .createdAt(Instant.parse("2025-08-02T09:00:00Z"))
            .painLevel(3).moodBucket(MoodBucket.NEUTRAL).energyBucket(EnergyBucket.HIGH)
            .build();

        CheckInEntity entity = CheckInEntity.from(record);

        assertThat(entity.getMoodBucket()).isEqualTo(1);
        assertThat(entity.getEnergyBucket()).isEqualTo(2);
        assertThat(entity.toRecord()).isEqualTo(record);
    }
}

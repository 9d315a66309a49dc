package com.careline.checkin.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Stored check-in row. Timestamps are UTC wall-clock values.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Table("check_ins")
@Schema(description = "Check-in entity stored in database")
public class CheckInEntity implements Persistable<String> {

    @Transient
    @Builder.Default
    private boolean isNew = true;

    @Id
    @Column("check_in_id")
    private String checkInId;

    @Column("subject_id")
    private String subjectId;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("pain_level")
    private Integer painLevel;

    @Column("energy_bucket")
    @Schema(description = "Energy rank (0 low, 1 okay, 2 high)")
    private Integer energyBucket;

    @Column("mood_bucket")
    @Schema(description = "Mood rank (0 sad, 1 neutral, 2 good)")
    private Integer moodBucket;

    @Column("symptoms")
    private String symptoms;

    @Column("concerns")
    private String concerns;

    @Column("team_note")
    private String teamNote;

    @Column("stored_at")
    private LocalDateTime storedAt;

    public static CheckInEntity from(CheckInRecord record) {
        return CheckInEntity.builder()
                .checkInId(record.getCheckInId())
                .subjectId(record.getSubjectId())
                .createdAt(LocalDateTime.ofInstant(record.getCreatedAt(), ZoneOffset.UTC))
                .painLevel(record.getPainLevel())
                .energyBucket(record.getEnergyBucket() == null ? null : record.getEnergyBucket().getRank())
                .moodBucket(record.getMoodBucket() == null ? null : record.getMoodBucket().getRank())
                .symptoms(record.getSymptoms())
                .concerns(record.getConcerns())
                .teamNote(record.getTeamNote())
                .build();
    }

    public CheckInRecord toRecord() {
        Instant created = createdAt == null ? null : createdAt.toInstant(ZoneOffset.UTC);
        return CheckInRecord.builder()
                .checkInId(checkInId)
                .subjectId(subjectId)
                .createdAt(created)
                .painLevel(painLevel)
                .energyBucket(EnergyBucket.fromRank(energyBucket))
                .moodBucket(MoodBucket.fromRank(moodBucket))
                .symptoms(symptoms)
                .concerns(concerns)
                .teamNote(teamNote)
                .build();
    }

    @Override
    public String getId() {
        return checkInId;
    }

    @Override
    public boolean isNew() {
        return isNew || checkInId == null;
    }
}

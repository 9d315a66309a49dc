package com.careline.alert.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Check-in forwarded by the check-in service for escalation review")
public class CheckInRecord {

    @Schema(description = "Unique check-in identifier")
    String checkInId;

    @Schema(description = "Subject (patient) identifier", example = "s-001")
    String subjectId;

    @Schema(description = "When the check-in was recorded", example = "2025-08-01T12:00:00Z")
    Instant createdAt;

    @Schema(description = "Self-reported pain, 0 to 10", example = "8")
    Integer painLevel;

    @Schema(allowableValues = {"low", "okay", "high"})
    EnergyBucket energyBucket;

    @Schema(allowableValues = {"sad", "neutral", "good"})
    MoodBucket moodBucket;

    String symptoms;

    String concerns;

    String teamNote;
}

package com.careline.checkin.model;

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
@Schema(description = "A single patient check-in; never modified once stored")
public class CheckInRecord {

    @Schema(description = "Unique check-in identifier", example = "5b0f1c9e-7c1f-4d8e-9a57-0c3b1a2f4e11")
    String checkInId;

    @Schema(description = "Subject (patient) identifier", example = "s-001")
    String subjectId;

    @Schema(description = "When the check-in was recorded", example = "2025-08-01T12:00:00Z")
    Instant createdAt;

    @Schema(description = "Self-reported pain, 0 to 10", example = "4")
    Integer painLevel;

    @Schema(description = "Self-reported energy", allowableValues = {"low", "okay", "high"})
    EnergyBucket energyBucket;

    @Schema(description = "Self-reported mood", allowableValues = {"sad", "neutral", "good"})
    MoodBucket moodBucket;

    @Schema(description = "Free-text symptoms", example = "tired and dizzy")
    String symptoms;

    @Schema(description = "Free-text concerns", example = "worried about my ride")
    String concerns;

    @Schema(description = "Note for the care team")
    String teamNote;
}

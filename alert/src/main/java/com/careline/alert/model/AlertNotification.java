package com.careline.alert.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
@Schema(description = "An escalation alert handed to the notification dispatcher")
public class AlertNotification {

    @Schema(description = "Unique alert identifier")
    String alertId;

    String subjectId;

    @Schema(description = "Check-in that triggered the evaluation")
    String checkInId;

    @Schema(description = "Rule that fired", allowableValues = {"highPain", "lowMood", "rapidPainIncrease", "rapidMoodDrop"})
    EscalationReasonKind reason;

    @Schema(example = "High pain alert")
    String title;

    @Schema(example = "Jordan Lee reported pain 9/10. Notify an admin to follow up.")
    String body;

    Instant triggeredAt;
}

package com.careline.alert.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Escalation thresholds. Immutable; built once at startup.
 */
@Value
@Builder
public class EscalationConfig {

    @Builder.Default
    int highPainThreshold = 8;

    @Builder.Default
    MoodBucket moodEscalationThreshold = MoodBucket.SAD;

    @Builder.Default
    int rapidPainLookbackDays = 3;

    @Builder.Default
    int rapidPainIncrease = 3;

    @Builder.Default
    int rapidPainFloor = 6;

    @Builder.Default
    int rapidMoodLookbackDays = 5;

    @Builder.Default
    int minTrendSamples = 3;

    @Builder.Default
    int notificationCooldownHours = 12;

    @Builder.Default
    int consecutiveSadMoodCount = 2;

    @Builder.Default
    int maxHistorySamples = 15;

    public static EscalationConfig defaults() {
        return EscalationConfig.builder().build();
    }

    public Duration getNotificationCooldown() {
        return Duration.ofHours(notificationCooldownHours);
    }

    public Duration getRapidPainLookback() {
        return Duration.ofDays(rapidPainLookbackDays);
    }

    public Duration getRapidMoodLookback() {
        return Duration.ofDays(rapidMoodLookbackDays);
    }
}

package com.careline.alert.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A triggered escalation reason and the values that justified it. Only the
 * fields relevant to {@link #getReason()} are set.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EscalationDetection {
    EscalationReasonKind reason;
    Integer painLevel;
    MoodBucket mood;
    Integer startPain;
    Integer endPain;
    MoodBucket previousMood;

    public static EscalationDetection highPain(int painLevel) {
        return new EscalationDetection(EscalationReasonKind.HIGH_PAIN, painLevel, null, null, null, null);
    }

    public static EscalationDetection lowMood(MoodBucket mood) {
        return new EscalationDetection(EscalationReasonKind.LOW_MOOD, null, mood, null, null, null);
    }

    public static EscalationDetection rapidPainIncrease(int startPain, int endPain) {
        return new EscalationDetection(EscalationReasonKind.RAPID_PAIN_INCREASE, null, null, startPain, endPain, null);
    }

    /**
     * @param previousMood the sample before the latest sad one; null when unknown
     */
    public static EscalationDetection rapidMoodDrop(MoodBucket previousMood) {
        return new EscalationDetection(EscalationReasonKind.RAPID_MOOD_DROP, null, MoodBucket.SAD, null, null, previousMood);
    }
}

package com.careline.alert.escalation;

import com.careline.alert.model.EscalationDetection;

/**
 * Staff-facing alert wording for each escalation reason.
 */
public final class EscalationMessages {

    static final String UNNAMED_SUBJECT = "this client";

    private EscalationMessages() {
    }

    public static String title(EscalationDetection detection) {
        switch (detection.getReason()) {
            case HIGH_PAIN:
                return "High pain alert";
            case LOW_MOOD:
                return "Low mood alert";
            case RAPID_PAIN_INCREASE:
                return "Pain trending up";
            case RAPID_MOOD_DROP:
                return "Mood worsening quickly";
            default:
                throw new IllegalArgumentException("Unknown escalation reason: " + detection.getReason());
        }
    }

    public static String body(EscalationDetection detection, String displayName) {
        String name = displayName == null || displayName.trim().isEmpty() ? UNNAMED_SUBJECT : displayName.trim();
        switch (detection.getReason()) {
            case HIGH_PAIN:
                return name + " reported pain " + detection.getPainLevel() + "/10. Notify an admin to follow up.";
            case LOW_MOOD:
                return name + " reported mood \"" + detection.getMood().getDisplayText() + "\". Consider proactive outreach.";
            case RAPID_PAIN_INCREASE:
                return name + "'s pain climbed from " + detection.getStartPain() + "/10 to "
                    + detection.getEndPain() + "/10 in the last few days.";
            case RAPID_MOOD_DROP:
                String previous = detection.getPreviousMood() == null
                    ? "recent days"
                    : detection.getPreviousMood().getDisplayText();
                return name + "'s mood dropped to Sad from " + previous + ". Review their check-ins.";
            default:
                throw new IllegalArgumentException("Unknown escalation reason: " + detection.getReason());
        }
    }
}

package com.careline.alert.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Escalation rules in precedence order; the detector reports the first that matches.
 */
public enum EscalationReasonKind {
    HIGH_PAIN("highPain"),
    LOW_MOOD("lowMood"),
    RAPID_PAIN_INCREASE("rapidPainIncrease"),
    RAPID_MOOD_DROP("rapidMoodDrop");

    private final String code;

    EscalationReasonKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}

package com.careline.alert.model;

import lombok.Value;

/**
 * Identifies one cooldown: a subject and the reason it was alerted for.
 */
@Value(staticConstructor = "of")
public class CooldownKey {
    String subjectId;
    EscalationReasonKind reason;

    @Override
    public String toString() {
        return subjectId + "|" + reason.getCode();
    }
}

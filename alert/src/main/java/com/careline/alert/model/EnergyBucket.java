package com.careline.alert.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Self-reported energy level as sent by the check-in service.
 */
public enum EnergyBucket {
    LOW("low", "Low", 0),
    OKAY("okay", "Okay", 1),
    HIGH("high", "High", 2);

    private final String code;
    private final String displayText;
    private final int rank;

    EnergyBucket(String code, String displayText, int rank) {
        this.code = code;
        this.displayText = displayText;
        this.rank = rank;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayText() {
        return displayText;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Lenient text parsing; unknown or blank text reads as no answer.
     */
    @JsonCreator
    public static EnergyBucket fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim().toLowerCase();
        for (EnergyBucket bucket : values()) {
            if (bucket.code.equals(normalized)) {
                return bucket;
            }
        }
        return null;
    }
}

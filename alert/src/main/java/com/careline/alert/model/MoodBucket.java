package com.careline.alert.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Self-reported mood. Severity comparisons use {@link #getRank()}: a lower
 * rank is a worse mood.
 */
public enum MoodBucket {
    SAD("sad", "Sad", 0),
    NEUTRAL("neutral", "Neutral", 1),
    GOOD("good", "Good", 2);

    private final String code;
    private final String displayText;
    private final int rank;

    MoodBucket(String code, String displayText, int rank) {
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

    public boolean isAtOrBelow(MoodBucket threshold) {
        return rank <= threshold.rank;
    }

    public boolean isWorseThan(MoodBucket other) {
        return rank < other.rank;
    }

    @JsonCreator
    public static MoodBucket fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim().toLowerCase();
        for (MoodBucket bucket : values()) {
            if (bucket.code.equals(normalized)) {
                return bucket;
            }
        }
        return null;
    }
}

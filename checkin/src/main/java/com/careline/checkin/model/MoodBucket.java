package com.careline.checkin.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Self-reported mood, ordered by an explicit severity rank (lower is worse).
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

    public static MoodBucket fromRank(Integer rank) {
        if (rank == null) {
            return null;
        }
        for (MoodBucket bucket : values()) {
            if (bucket.rank == rank) {
                return bucket;
            }
        }
        return null;
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

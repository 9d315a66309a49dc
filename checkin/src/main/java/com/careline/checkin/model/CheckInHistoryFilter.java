package com.careline.checkin.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Typed filter for history queries. Every bound is optional.
 */
@Value
@Builder
public class CheckInHistoryFilter {

    /** Inclusive lower bound on {@code createdAt}. */
    Instant startDate;

    /** Inclusive upper bound on {@code createdAt}. */
    Instant endDate;

    /** Case-insensitive substring matched against symptoms or concerns. */
    String keyword;

    /** Maximum number of records, newest first. */
    Integer limit;

    public String normalizedKeyword() {
        if (keyword == null || keyword.trim().isEmpty()) {
            return null;
        }
        return keyword.trim();
    }

    public Integer normalizedLimit() {
        return limit == null ? null : Math.max(0, limit);
    }
}

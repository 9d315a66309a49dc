package com.careline.alert.escalation;

import com.careline.alert.model.CooldownKey;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Last-notified timestamps per (subject, reason). Entries are never removed.
 * {@link #markNotified} must be an atomic upsert so concurrent evaluations
 * cannot lose an update.
 */
public interface CooldownStore {

    /**
     * @return the last notification time, or empty if the pair was never notified
     */
    Mono<Instant> lastNotified(CooldownKey key);

    Mono<Void> markNotified(CooldownKey key, Instant at);

    /**
     * Atomically records {@code at} as the last notification, but only when the pair
     * was never notified or its last notification is at least {@code cooldown} old.
     * Of several concurrent claims on an armed pair exactly one wins.
     *
     * @return true if this call claimed the pair
     */
    Mono<Boolean> claim(CooldownKey key, Instant at, Duration cooldown);
}

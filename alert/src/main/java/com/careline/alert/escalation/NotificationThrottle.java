package com.careline.alert.escalation;

import com.careline.alert.model.CooldownKey;
import com.careline.alert.model.EscalationConfig;
import com.careline.alert.model.EscalationReasonKind;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Per (subject, reason) cooldown. A pair may notify when it never has, or when
 * at least the configured cooldown has elapsed since it last did; the boundary
 * is inclusive. Holds no state of its own.
 */
@Component
public class NotificationThrottle {

    private final CooldownStore cooldownStore;
    private final Duration cooldown;

    public NotificationThrottle(CooldownStore cooldownStore, EscalationConfig config) {
        this.cooldownStore = cooldownStore;
        this.cooldown = config.getNotificationCooldown();
    }

    public Mono<Boolean> shouldNotify(String subjectId, EscalationReasonKind reason, Instant now) {
        return cooldownStore.lastNotified(CooldownKey.of(subjectId, reason))
            .map(last -> Duration.between(last, now).compareTo(cooldown) >= 0)
            .defaultIfEmpty(true);
    }

    public Mono<Void> markNotified(String subjectId, EscalationReasonKind reason, Instant now) {
        return cooldownStore.markNotified(CooldownKey.of(subjectId, reason), now);
    }

    /**
     * {@link #shouldNotify} and {@link #markNotified} as one atomic step. When several
     * evaluations race for the same armed pair only one gets {@code true}.
     */
    public Mono<Boolean> tryAcquire(String subjectId, EscalationReasonKind reason, Instant now) {
        return cooldownStore.claim(CooldownKey.of(subjectId, reason), now, cooldown);
    }
}

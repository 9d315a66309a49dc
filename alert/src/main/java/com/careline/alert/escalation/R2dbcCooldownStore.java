package com.careline.alert.escalation;

import com.careline.alert.model.CooldownEntity;
import com.careline.alert.model.CooldownKey;
import com.careline.alert.repository.CooldownRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

@Component
public class R2dbcCooldownStore implements CooldownStore {

    private static final Logger logger = LoggerFactory.getLogger(R2dbcCooldownStore.class);

    private final CooldownRepository cooldownRepository;

    public R2dbcCooldownStore(CooldownRepository cooldownRepository) {
        this.cooldownRepository = cooldownRepository;
    }

    @Override
    public Mono<Instant> lastNotified(CooldownKey key) {
        return cooldownRepository.findBySubjectIdAndReason(key.getSubjectId(), key.getReason().getCode())
            .mapNotNull(CooldownEntity::lastNotifiedAt);
    }

    @Override
    public Mono<Void> markNotified(CooldownKey key, Instant at) {
        return cooldownRepository.upsert(key.getSubjectId(), key.getReason().getCode(), at.toEpochMilli())
            .doOnSuccess(rows -> logger.debug("Cooldown {} set to {}", key, at))
            .doOnError(error -> logger.error("Error saving cooldown {}: {}", key, error.getMessage()))
            .then();
    }

    /**
     * Conditional update of an elapsed row first; when no row moved, an insert that
     * loses to a concurrent insert on the unique (subject, reason) key counts as not claimed.
     */
    @Override
    public Mono<Boolean> claim(CooldownKey key, Instant at, Duration cooldown) {
        String subjectId = key.getSubjectId();
        String reason = key.getReason().getCode();
        long atMs = at.toEpochMilli();

        return cooldownRepository.claimIfArmed(subjectId, reason, atMs, atMs - cooldown.toMillis())
            .flatMap(updated -> updated > 0
                ? Mono.just(true)
                : cooldownRepository.insertCooldown(subjectId, reason, atMs)
                    .map(inserted -> inserted > 0)
                    .onErrorResume(DataIntegrityViolationException.class, error -> {
                        logger.debug("Cooldown {} already present, not claimed", key);
                        return Mono.just(false);
                    }))
            .doOnSuccess(claimed -> logger.debug("Cooldown {} claim at {}: {}", key, at, claimed))
            .doOnError(error -> logger.error("Error claiming cooldown {}: {}", key, error.getMessage()));
    }
}

package com.careline.alert.repository;

import com.careline.alert.model.CooldownEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface CooldownRepository extends ReactiveCrudRepository<CooldownEntity, Long> {

    Mono<CooldownEntity> findBySubjectIdAndReason(String subjectId, String reason);

    /**
     * Inserts or replaces the cooldown for one (subject, reason) pair in a single statement.
     */
    @Modifying
    @Query("MERGE INTO escalation_cooldowns (subject_id, reason, last_notified_epoch_ms) "
        + "KEY (subject_id, reason) VALUES (:subjectId, :reason, :epochMs)")
    Mono<Integer> upsert(String subjectId, String reason, long epochMs);

    /**
     * Moves an existing cooldown to {@code epochMs} only if it was last notified at or
     * before {@code armedBeforeMs}.
     *
     * @return 1 when the row was claimed, 0 when it is still cooling or absent
     */
    @Modifying
    @Query("UPDATE escalation_cooldowns SET last_notified_epoch_ms = :epochMs "
        + "WHERE subject_id = :subjectId AND reason = :reason AND last_notified_epoch_ms <= :armedBeforeMs")
    Mono<Integer> claimIfArmed(String subjectId, String reason, long epochMs, long armedBeforeMs);

    /**
     * Plain insert; a second insert for the same pair fails on the unique constraint.
     */
    @Modifying
    @Query("INSERT INTO escalation_cooldowns (subject_id, reason, last_notified_epoch_ms) "
        + "VALUES (:subjectId, :reason, :epochMs)")
    Mono<Integer> insertCooldown(String subjectId, String reason, long epochMs);
}

package com.careline.checkin.repository;

import com.careline.checkin.model.CheckInEntity;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Check-in storage. History queries go through
 * {@link com.careline.checkin.history.RepositoryHistorySource}.
 */
@Repository
public interface CheckInRepository extends R2dbcRepository<CheckInEntity, String> {

    Mono<Long> countBySubjectId(String subjectId);
}

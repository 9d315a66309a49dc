package com.careline.checkin.repository;

import com.careline.checkin.model.SubjectEntity;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface SubjectRepository extends R2dbcRepository<SubjectEntity, String> {

    Mono<Boolean> existsBySubjectId(String subjectId);
}

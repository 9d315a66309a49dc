package com.careline.alert.repository;

import com.careline.alert.model.Alert;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface AlertRepository extends ReactiveCrudRepository<Alert, Long> {

    Flux<Alert> findBySubjectIdOrderByTriggeredAtDesc(String subjectId);
}

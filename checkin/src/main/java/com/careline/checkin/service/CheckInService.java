package com.careline.checkin.service;

import com.careline.checkin.exception.SubjectNotFoundException;
import com.careline.checkin.history.HistorySource;
import com.careline.checkin.model.*;
import com.careline.checkin.repository.CheckInRepository;
import com.careline.checkin.repository.SubjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

@Service
public class CheckInService {

    private static final Logger logger = LoggerFactory.getLogger(CheckInService.class);

    private static final int PAIN_MIN = 0;
    private static final int PAIN_MAX = 10;

    private final CheckInRepository checkInRepository;
    private final SubjectRepository subjectRepository;
    private final HistorySource historySource;
    private final CheckInSanitizer sanitizer;
    private final WebClient webClient;
    private final Clock clock;

    @Value("${alert.service.url:http://localhost:8082}")
    private String alertServiceUrl;

    @Value("${alert.service.timeout.seconds:5}")
    private int alertServiceTimeoutSeconds = 5;

    @Value("${alert.forwarding.enabled:true}")
    private boolean forwardingEnabled = true;

    public CheckInService(CheckInRepository checkInRepository,
                          SubjectRepository subjectRepository,
                          HistorySource historySource,
                          CheckInSanitizer sanitizer,
                          WebClient.Builder webClientBuilder,
                          Clock clock) {
        this.checkInRepository = checkInRepository;
        this.subjectRepository = subjectRepository;
        this.historySource = historySource;
        this.sanitizer = sanitizer;
        this.webClient = webClientBuilder.build();
        this.clock = clock;
    }

    /**
     * Validates, sanitizes and stores one check-in, then hands it to the alert
     * service without waiting for the evaluation.
     *
     * @return the stored record; the existing record if the id was already stored
     */
    public Mono<CheckInRecord> submitCheckIn(CheckInRecord submission) {
        return validateCheckIn(submission)
            .then(Mono.fromSupplier(() -> prepare(submission)))
            .flatMap(record -> requireSubject(record.getSubjectId()).thenReturn(record))
            .flatMap(record -> checkInRepository.findById(record.getCheckInId())
                .map(existing -> {
                    logger.info("Check-in {} already stored, ignoring duplicate", record.getCheckInId());
                    return existing.toRecord();
                })
                .switchIfEmpty(Mono.defer(() -> saveCheckIn(record)
                    .doOnSuccess(this::forwardToAlertService))));
    }

    private Mono<Void> validateCheckIn(CheckInRecord submission) {
        return Mono.fromRunnable(() -> {
            if (submission == null) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "check-in body is required");
            }
            if (submission.getSubjectId() == null || submission.getSubjectId().trim().isEmpty()) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "subjectId is required");
            }
            if (submission.getPainLevel() == null) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "painLevel is required");
            }
            if (submission.getPainLevel() < PAIN_MIN || submission.getPainLevel() > PAIN_MAX) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "painLevel must be between " + PAIN_MIN + " and " + PAIN_MAX);
            }
        });
    }

    private CheckInRecord prepare(CheckInRecord submission) {
        CheckInRecord sanitized = sanitizer.sanitize(submission);
        CheckInRecord.CheckInRecordBuilder builder = sanitized.toBuilder();
        if (sanitized.getCheckInId() == null || sanitized.getCheckInId().trim().isEmpty()) {
            builder.checkInId(UUID.randomUUID().toString());
        }
        if (sanitized.getCreatedAt() == null) {
            builder.createdAt(clock.instant());
        }
        return builder.build();
    }

    private Mono<Void> requireSubject(String subjectId) {
        return subjectRepository.existsBySubjectId(subjectId)
            .flatMap(exists -> exists
                ? Mono.<Void>empty()
                : Mono.<Void>error(new SubjectNotFoundException(subjectId)));
    }

    private Mono<CheckInRecord> saveCheckIn(CheckInRecord record) {
        CheckInEntity entity = CheckInEntity.from(record);
        entity.setStoredAt(LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
        return checkInRepository.save(entity)
            .map(CheckInEntity::toRecord)
            .doOnSuccess(saved -> logger.info("Saved check-in {} for subject {}",
                saved.getCheckInId(), saved.getSubjectId()))
            .doOnError(error -> logger.error("Error saving check-in: {}", error.getMessage()));
    }

    /**
     * Fire-and-forget: runs on a bounded-elastic worker so submission never waits on it.
     */
    private void forwardToAlertService(CheckInRecord record) {
        if (!forwardingEnabled || record == null) {
            return;
        }
        webClient
            .post()
            .uri(alertServiceUrl + "/evaluate")
            .bodyValue(List.of(record))
            .retrieve()
            .toBodilessEntity()
            .timeout(Duration.ofSeconds(alertServiceTimeoutSeconds))
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(
                response -> logger.info("Forwarded check-in {} to alert service", record.getCheckInId()),
                error -> logger.error("Alert service communication failed for check-in {}: {}",
                    record.getCheckInId(), error.getMessage()));
    }

    public Mono<Subject> registerSubject(Subject request) {
        if (request == null || request.getDisplayName() == null || request.getDisplayName().trim().isEmpty()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "displayName is required"));
        }
        String subjectId = request.getSubjectId() == null || request.getSubjectId().trim().isEmpty()
            ? UUID.randomUUID().toString()
            : request.getSubjectId().trim();

        return subjectRepository.findById(subjectId)
            .switchIfEmpty(Mono.defer(() -> subjectRepository.save(SubjectEntity.builder()
                    .subjectId(subjectId)
                    .displayName(request.getDisplayName().strip())
                    .build())
                .doOnSuccess(saved -> logger.info("Registered subject {}", saved.getSubjectId()))))
            .map(SubjectEntity::toSubject);
    }

    public Mono<Subject> getSubject(String subjectId) {
        return subjectRepository.findById(subjectId)
            .map(SubjectEntity::toSubject)
            .switchIfEmpty(Mono.error(new SubjectNotFoundException(subjectId)));
    }

    public Mono<List<CheckInRecord>> getHistory(String subjectId, CheckInHistoryFilter filter) {
        logger.info("Fetching history for subject {}", subjectId);
        return historySource.fetchHistory(subjectId, filter);
    }

    /**
     * Reads only the newest check-in; the record count comes from a separate count query.
     */
    public Mono<LatestCheckInSummary> getLatestSummary(String subjectId) {
        return historySource.fetchHistory(subjectId, CheckInHistoryFilter.builder().limit(1).build())
            .zipWhen(newest -> checkInRepository.countBySubjectId(subjectId))
            .map(loaded -> LatestCheckInSummary.from(subjectId, loaded.getT1(), loaded.getT2()));
    }

    public Mono<Void> clearAllData() {
        logger.info("Clearing all check-ins and subjects from database");
        return checkInRepository.deleteAll()
            .then(subjectRepository.deleteAll())
            .doOnSuccess(result -> logger.info("Successfully cleared all check-in data"))
            .doOnError(error -> logger.error("Error clearing check-in data: {}", error.getMessage()));
    }
}

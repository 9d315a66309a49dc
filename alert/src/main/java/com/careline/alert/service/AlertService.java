package com.careline.alert.service;

import com.careline.alert.escalation.EscalationDetector;
import com.careline.alert.escalation.EscalationMessages;
import com.careline.alert.escalation.NotificationThrottle;
import com.careline.alert.exception.HistoryUnavailableException;
import com.careline.alert.exception.SubjectNotFoundException;
import com.careline.alert.history.HistorySource;
import com.careline.alert.model.*;
import com.careline.alert.notification.NotificationDispatcher;
import com.careline.alert.repository.AlertRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Runs the escalation workflow for incoming check-ins: load history, detect,
 * check the cooldown, claim it, dispatch.
 *
 * <p>Fail-open: when the subject or its history cannot be loaded the
 * evaluation is logged and ends without an alert.
 */
@Service
public class AlertService {

    private static final Logger logger = LoggerFactory.getLogger(AlertService.class);

    private final HistorySource historySource;
    private final EscalationDetector detector;
    private final NotificationThrottle throttle;
    private final NotificationDispatcher dispatcher;
    private final AlertRepository alertRepository;
    private final EscalationConfig config;
    private final Clock clock;

    public AlertService(HistorySource historySource,
                        EscalationDetector detector,
                        NotificationThrottle throttle,
                        NotificationDispatcher dispatcher,
                        AlertRepository alertRepository,
                        EscalationConfig config,
                        Clock clock) {
        this.historySource = historySource;
        this.detector = detector;
        this.throttle = throttle;
        this.dispatcher = dispatcher;
        this.alertRepository = alertRepository;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Evaluates check-ins one after another, in order.
     * @return the alerts dispatched by this call
     */
    public Flux<AlertNotification> evaluateCheckIns(List<CheckInRecord> checkIns) {
        logger.info("Evaluating {} check-ins", checkIns.size());

        return Flux.fromIterable(checkIns)
            .concatMap(checkIn -> evaluateCheckIn(checkIn)
                .onErrorResume(error -> {
                    logger.error("Error evaluating check-in {}: {}", checkIn.getCheckInId(), error.getMessage());
                    // Continue with the remaining check-ins
                    return Mono.empty();
                }));
    }

    public Mono<AlertNotification> evaluateCheckIn(CheckInRecord checkIn) {
        if (checkIn == null || checkIn.getSubjectId() == null || checkIn.getSubjectId().trim().isEmpty()) {
            logger.warn("escalation_skipped reason=missing_subject");
            return Mono.empty();
        }
        Instant now = clock.instant();
        CheckInRecord latest = checkIn.getCreatedAt() == null ? checkIn.toBuilder().createdAt(now).build() : checkIn;
        String subjectId = latest.getSubjectId();
        logger.debug("Evaluating check-in {} for subject {}", latest.getCheckInId(), subjectId);

        return historySource.findSubject(subjectId)
            .zipWhen(subject -> historySource.fetchHistory(subjectId, config.getMaxHistorySamples()))
            .flatMap(loaded -> escalate(latest, loaded.getT1(), loaded.getT2(), now))
            .onErrorResume(HistoryUnavailableException.class, error -> {
                String cause = error instanceof SubjectNotFoundException ? "subject_not_found" : "history_unavailable";
                logger.warn("escalation_skipped reason={} subject={} checkIn={}: {}",
                    cause, subjectId, latest.getCheckInId(), error.getMessage());
                return Mono.empty();
            });
    }

    private Mono<AlertNotification> escalate(CheckInRecord latest, Subject subject,
                                             List<CheckInRecord> history, Instant now) {
        String subjectId = latest.getSubjectId();
        return Mono.justOrEmpty(detector.evaluate(latest, history, now))
            .flatMap(detection -> throttle.shouldNotify(subjectId, detection.getReason(), now)
                .flatMap(allowed -> allowed
                    ? throttle.tryAcquire(subjectId, detection.getReason(), now)
                    : Mono.just(false))
                .flatMap(acquired -> {
                    if (!acquired) {
                        logger.info("Escalation {} for subject {} suppressed by cooldown",
                            detection.getReason().getCode(), subjectId);
                        return Mono.<AlertNotification>empty();
                    }
                    // Cooldown is already recorded; delivery itself is fire-and-forget
                    AlertNotification notification = compose(latest, subject, detection, now);
                    dispatcher.send(notification);
                    logger.warn("escalation_notified reason={} subject={}",
                        detection.getReason().getCode(), subjectId);
                    return Mono.just(notification);
                }));
    }

    private AlertNotification compose(CheckInRecord latest, Subject subject, EscalationDetection detection, Instant now) {
        return AlertNotification.builder()
            .alertId(UUID.randomUUID().toString())
            .subjectId(latest.getSubjectId())
            .checkInId(latest.getCheckInId())
            .reason(detection.getReason())
            .title(EscalationMessages.title(detection))
            .body(EscalationMessages.body(detection, subject.getDisplayName()))
            .triggeredAt(now)
            .build();
    }

    public Flux<Alert> getAlertsBySubjectId(String subjectId) {
        logger.info("Fetching alerts for subject: {}", subjectId);
        return alertRepository.findBySubjectIdOrderByTriggeredAtDesc(subjectId);
    }

    public Mono<Void> clearAllAlerts() {
        logger.info("Clearing all alerts from database");
        return alertRepository.deleteAll()
            .doOnSuccess(result -> logger.info("Successfully cleared all alerts"))
            .doOnError(error -> logger.error("Error clearing alerts: {}", error.getMessage()));
    }
}

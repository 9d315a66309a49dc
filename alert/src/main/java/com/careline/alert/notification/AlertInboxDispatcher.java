package com.careline.alert.notification;

import com.careline.alert.model.Alert;
import com.careline.alert.model.AlertNotification;
import com.careline.alert.repository.AlertRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Delivers alerts to the staff inbox by storing them.
 */
@Component
public class AlertInboxDispatcher implements NotificationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(AlertInboxDispatcher.class);

    private final AlertRepository alertRepository;

    public AlertInboxDispatcher(AlertRepository alertRepository) {
        this.alertRepository = alertRepository;
    }

    @Override
    public void send(AlertNotification notification) {
        alertRepository.save(Alert.from(notification))
            .subscribe(
                saved -> logger.info("Alert {} delivered to inbox for subject {} ({})",
                    saved.getAlertId(), saved.getSubjectId(), saved.getReason()),
                error -> logger.error("Failed to deliver alert {} for subject {}: {}",
                    notification.getAlertId(), notification.getSubjectId(), error.getMessage()));
    }
}

package com.careline.alert.notification;

import com.careline.alert.model.AlertNotification;

/**
 * Delivers an escalation alert. Fire-and-forget: callers never wait on
 * delivery and never see its failures.
 */
public interface NotificationDispatcher {

    void send(AlertNotification notification);
}

package com.careline.alert.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Stored alert in the staff inbox. Timestamps are UTC wall-clock values.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Table("alerts")
@Schema(description = "Alert stored in the staff inbox")
public class Alert {
    @Id
    private Long id;

    @Column("alert_id")
    private String alertId;

    @Column("subject_id")
    private String subjectId;

    @Column("check_in_id")
    private String checkInId;

    @Column("reason")
    private String reason;

    @Column("title")
    private String title;

    @Column("body")
    private String body;

    @Column("triggered_at")
    private LocalDateTime triggeredAt;

    @Column("created_at")
    private LocalDateTime createdAt;

    public static Alert from(AlertNotification notification) {
        Alert alert = new Alert();
        alert.setAlertId(notification.getAlertId());
        alert.setSubjectId(notification.getSubjectId());
        alert.setCheckInId(notification.getCheckInId());
        alert.setReason(notification.getReason().getCode());
        alert.setTitle(notification.getTitle());
        alert.setBody(notification.getBody());
        alert.setTriggeredAt(LocalDateTime.ofInstant(notification.getTriggeredAt(), ZoneOffset.UTC));
        alert.setCreatedAt(LocalDateTime.now(ZoneOffset.UTC));
        return alert;
    }
}

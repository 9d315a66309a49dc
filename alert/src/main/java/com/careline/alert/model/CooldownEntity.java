package com.careline.alert.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Table("escalation_cooldowns")
public class CooldownEntity {
    @Id
    private Long id;

    @Column("subject_id")
    private String subjectId;

    @Column("reason")
    private String reason;

    @Column("last_notified_epoch_ms")
    private Long lastNotifiedEpochMs;

    public Instant lastNotifiedAt() {
        return lastNotifiedEpochMs == null ? null : Instant.ofEpochMilli(lastNotifiedEpochMs);
    }
}

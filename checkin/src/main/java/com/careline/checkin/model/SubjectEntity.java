package com.careline.checkin.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Table("subjects")
public class SubjectEntity implements Persistable<String> {

    @Transient
    @Builder.Default
    private boolean isNew = true;

    @Id
    @Column("subject_id")
    private String subjectId;

    @Column("display_name")
    private String displayName;

    @Column("created_at")
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now(ZoneOffset.UTC);

    public Subject toSubject() {
        return new Subject(subjectId, displayName, createdAt == null ? null : createdAt.toInstant(ZoneOffset.UTC));
    }

    @Override
    public String getId() {
        return subjectId;
    }

    @Override
    public boolean isNew() {
        return isNew || subjectId == null;
    }
}

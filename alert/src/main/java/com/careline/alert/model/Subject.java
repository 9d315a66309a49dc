package com.careline.alert.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Subject {
    private String subjectId;
    private String displayName;
    private Instant createdAt;
}

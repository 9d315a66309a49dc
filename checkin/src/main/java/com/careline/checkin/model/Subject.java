package com.careline.checkin.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "A patient whose check-ins are tracked")
public class Subject {

    @Schema(description = "Subject identifier", example = "s-001")
    private String subjectId;

    @Schema(description = "Name shown to clinical staff", example = "Jordan Lee")
    private String displayName;

    private Instant createdAt;
}

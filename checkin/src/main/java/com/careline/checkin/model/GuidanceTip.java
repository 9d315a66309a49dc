package com.careline.checkin.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

import java.util.List;

@Value
@Schema(description = "Self-care tip shown for a symptom or concern category")
public class GuidanceTip {
    String id;
    String title;
    String body;

    @Schema(description = "Categories that bring this tip up")
    List<String> categories;
}

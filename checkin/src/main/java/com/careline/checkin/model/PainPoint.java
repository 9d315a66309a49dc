package com.careline.checkin.model;

import lombok.Value;

import java.time.Instant;

@Value
public class PainPoint {
    Instant timestamp;
    int value;
}

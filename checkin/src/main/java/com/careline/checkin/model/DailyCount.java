package com.careline.checkin.model;

import lombok.Value;

import java.time.LocalDate;

@Value
public class DailyCount {
    LocalDate day;
    int count;
}

package com.careline.checkin.model;

import lombok.Value;

@Value
public class CategoryCount {
    String category;
    int count;
}

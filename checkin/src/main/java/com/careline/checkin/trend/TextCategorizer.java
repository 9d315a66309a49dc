package com.careline.checkin.trend;

import java.util.List;

/**
 * Maps free text to canonical category tags. Implementations are pure and
 * return an empty list for null or blank input.
 */
public interface TextCategorizer {

    List<String> categorize(String text);
}

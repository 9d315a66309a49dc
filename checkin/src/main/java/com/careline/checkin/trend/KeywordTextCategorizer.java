package com.careline.checkin.trend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Substring keyword matcher. Text that matches no category is tagged {@value #OTHER}.
 * Returned tags are sorted alphabetically.
 */
public class KeywordTextCategorizer implements TextCategorizer {

    public static final String OTHER = "other";

    private final Map<String, List<String>> keywordMap;

    public KeywordTextCategorizer(Map<String, List<String>> keywordMap) {
        this.keywordMap = Collections.unmodifiableMap(new LinkedHashMap<>(keywordMap));
    }

    @Override
    public List<String> categorize(String text) {
        if (text == null || text.trim().isEmpty()) {
            return List.of();
        }
        String normalized = text.toLowerCase(Locale.ROOT);

        List<String> categories = new ArrayList<>();
        keywordMap.forEach((category, keywords) -> {
            if (keywords.stream().anyMatch(normalized::contains)) {
                categories.add(category);
            }
        });

        if (categories.isEmpty()) {
            categories.add(OTHER);
        }
        Collections.sort(categories);
        return List.copyOf(categories);
    }

    public static KeywordTextCategorizer symptoms() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("cramps", List.of("cramp", "cramps", "charley horse"));
        map.put("nausea", List.of("nausea", "nauseous", "vomit", "throw up"));
        map.put("dizziness", List.of("dizzy", "dizziness", "lightheaded"));
        map.put("shortness_of_breath", List.of("short of breath", "breathless", "can't breathe"));
        map.put("swelling", List.of("swelling", "swollen", "edema", "puffy"));
        map.put("headache", List.of("headache", "migraine"));
        map.put("access_site", List.of("fistula", "graft", "catheter", "access", "arm pain", "needle"));
        map.put("fatigue", List.of("tired", "fatigue", "exhausted", "weak"));
        map.put("fever_chills", List.of("fever", "chills", "hot", "cold"));
        return new KeywordTextCategorizer(map);
    }

    public static KeywordTextCategorizer concerns() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("diet_fluids", List.of("diet", "food", "salt", "sodium", "fluid", "thirst", "water"));
        map.put("medications", List.of("med", "meds", "medicine", "pill", "prescription"));
        map.put("schedule_transport", List.of("late", "time", "schedule", "ride", "transport", "bus"));
        map.put("access_care", List.of("access", "needle", "arm", "fistula", "graft", "catheter"));
        map.put("symptoms", List.of("cramp", "nausea", "dizzy", "breath", "swelling", "pain"));
        map.put("financial_insurance", List.of("bill", "cost", "insurance", "money"));
        map.put("emotional_support", List.of("scared", "anxious", "stress", "depressed", "worried"));
        return new KeywordTextCategorizer(map);
    }
}

package com.careline.checkin.service;

import com.careline.checkin.model.CheckInRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Normalizes free text on incoming check-ins before they are stored.
 */
@Component
public class CheckInSanitizer {

    @Value("${checkin.text.max-chars:1000}")
    private int maxChars = 1000;

    public CheckInRecord sanitize(CheckInRecord record) {
        return record.toBuilder()
            .subjectId(record.getSubjectId() == null ? null : record.getSubjectId().trim())
            .symptoms(note(record.getSymptoms()))
            .concerns(note(record.getConcerns()))
            .teamNote(note(record.getTeamNote()))
            .build();
    }

    /**
     * Strips control characters except newline and tab, normalizes line endings,
     * trims, and truncates. Blank text becomes null.
     */
    String note(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.replace("\r\n", "\n").replace('\r', '\n');

        StringBuilder kept = new StringBuilder(normalized.length());
        normalized.codePoints().forEach(cp -> {
            if (cp == '\n' || cp == '\t' || !Character.isISOControl(cp)) {
                kept.appendCodePoint(cp);
            }
        });

        String trimmed = kept.toString().strip();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.codePointCount(0, trimmed.length()) <= maxChars) {
            return trimmed;
        }
        return trimmed.substring(0, trimmed.offsetByCodePoints(0, maxChars));
    }
}

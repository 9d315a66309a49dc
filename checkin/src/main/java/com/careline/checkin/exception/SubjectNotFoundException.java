package com.careline.checkin.exception;

public class SubjectNotFoundException extends HistoryUnavailableException {

    private final String subjectId;

    public SubjectNotFoundException(String subjectId) {
        super("Subject not found: " + subjectId);
        this.subjectId = subjectId;
    }

    public String getSubjectId() {
        return subjectId;
    }
}

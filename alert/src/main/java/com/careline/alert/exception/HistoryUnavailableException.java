package com.careline.alert.exception;

/**
 * The check-in service could not supply a subject or its history. The
 * evaluation that needed it ends without an alert.
 */
public class HistoryUnavailableException extends RuntimeException {

    public HistoryUnavailableException(String message) {
        super(message);
    }

    public HistoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

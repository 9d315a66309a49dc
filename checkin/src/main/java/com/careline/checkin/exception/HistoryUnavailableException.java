package com.careline.checkin.exception;

/**
 * A history query failed or its subject could not be resolved. Callers treat
 * this as "no data" for the current request; nothing retries it.
 */
public class HistoryUnavailableException extends RuntimeException {

    public HistoryUnavailableException(String message) {
        super(message);
    }

    public HistoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.careline.checkin.history;

import com.careline.checkin.model.CheckInHistoryFilter;
import com.careline.checkin.model.CheckInRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read access to a subject's check-in history.
 */
public interface HistorySource {

    /**
     * Fetches check-ins for a subject, newest first by {@code createdAt}.
     *
     * @return the matching records; signals {@code SubjectNotFoundException} for an
     *         unknown subject and {@code HistoryUnavailableException} for any other failure
     */
    Mono<List<CheckInRecord>> fetchHistory(String subjectId, CheckInHistoryFilter filter);
}

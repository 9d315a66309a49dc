package com.careline.alert.history;

import com.careline.alert.model.CheckInRecord;
import com.careline.alert.model.Subject;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read access to subjects and their check-in history.
 *
 * <p>Failures are signalled as {@link com.careline.alert.exception.HistoryUnavailableException};
 * an unknown subject as its subclass {@link com.careline.alert.exception.SubjectNotFoundException}.
 */
public interface HistorySource {

    Mono<Subject> findSubject(String subjectId);

    /**
     * @return up to {@code limit} check-ins, newest first
     */
    Mono<List<CheckInRecord>> fetchHistory(String subjectId, int limit);
}

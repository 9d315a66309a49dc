package com.careline.alert.history;

import com.careline.alert.exception.HistoryUnavailableException;
import com.careline.alert.exception.SubjectNotFoundException;
import com.careline.alert.model.CheckInRecord;
import com.careline.alert.model.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Reads subjects and history from the check-in service over HTTP. Calls are
 * bounded by a timeout and never retried.
 */
@Component
public class CheckInServiceHistorySource implements HistorySource {

    private static final Logger logger = LoggerFactory.getLogger(CheckInServiceHistorySource.class);

    private static final ParameterizedTypeReference<List<CheckInRecord>> CHECK_IN_LIST =
        new ParameterizedTypeReference<>() {};

    private final WebClient webClient;

    @Value("${checkin.service.url:http://localhost:8081}")
    private String checkInServiceUrl;

    @Value("${checkin.service.timeout.seconds:5}")
    private int timeoutSeconds = 5;

    public CheckInServiceHistorySource(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.build();
    }

    @Override
    public Mono<Subject> findSubject(String subjectId) {
        return webClient
            .get()
            .uri(checkInServiceUrl + "/subjects/{subjectId}", subjectId)
            .retrieve()
            .bodyToMono(Subject.class)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .switchIfEmpty(Mono.error(() -> new SubjectNotFoundException(subjectId)))
            .onErrorMap(error -> translate(subjectId, error));
    }

    @Override
    public Mono<List<CheckInRecord>> fetchHistory(String subjectId, int limit) {
        logger.debug("Fetching up to {} check-ins for subject {}", limit, subjectId);
        return webClient
            .get()
            .uri(checkInServiceUrl + "/subjects/{subjectId}/checkins?limit={limit}", subjectId, limit)
            .retrieve()
            .bodyToMono(CHECK_IN_LIST)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .defaultIfEmpty(List.of())
            .onErrorMap(error -> translate(subjectId, error));
    }

    private Throwable translate(String subjectId, Throwable error) {
        if (error instanceof HistoryUnavailableException) {
            return error;
        }
        if (error instanceof WebClientResponseException.NotFound) {
            return new SubjectNotFoundException(subjectId);
        }
        return new HistoryUnavailableException(
            "Check-in service unavailable for subject " + subjectId + ": " + error.getMessage(), error);
    }
}

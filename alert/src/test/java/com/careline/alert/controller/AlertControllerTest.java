package com.careline.alert.controller;

import com.careline.alert.model.*;
import com.careline.alert.service.AlertService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@WebFluxTest(AlertController.class)
@ActiveProfiles("test")
class AlertControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private AlertService alertService;

    @Test
    @DisplayName("Should evaluate forwarded check-ins and return dispatched alerts")
    void testEvaluate() {
        AlertNotification notification = AlertNotification.builder()
            .alertId("a-1")
            .subjectId("s-001")
            .checkInId("c-1")
            .reason(EscalationReasonKind.HIGH_PAIN)
            .title("High pain alert")
            .body("Jordan Lee reported pain 9/10. Notify an admin to follow up.")
            .triggeredAt(Instant.parse("2025-08-01T12:00:00Z"))
            .build();
        when(alertService.evaluateCheckIns(anyList())).thenReturn(Flux.just(notification));

        webTestClient.post()
            .uri("/evaluate")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("""
                [{
                    "checkInId": "c-1",
                    "subjectId": "s-001",
                    "createdAt": "2025-08-01T12:00:00Z",
                    "painLevel": 9,
                    "moodBucket": "neutral"
                }]
                """)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(1)
            .jsonPath("$[0].reason").isEqualTo("highPain")
            .jsonPath("$[0].title").isEqualTo("High pain alert");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<CheckInRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(alertService).evaluateCheckIns(captor.capture());
        CheckInRecord received = captor.getValue().get(0);
        assertThat(received.getPainLevel()).isEqualTo(9);
        assertThat(received.getMoodBucket()).isEqualTo(MoodBucket.NEUTRAL);
    }

    @Test
    @DisplayName("Should accept a single check-in object as a one-element list")
    void testEvaluateSingleObject() {
        when(alertService.evaluateCheckIns(anyList())).thenReturn(Flux.empty());

        webTestClient.post()
            .uri("/evaluate")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"checkInId\": \"c-1\", \"subjectId\": \"s-001\", \"painLevel\": 2}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(0);
    }

    @Test
    @DisplayName("Should return 500 with an empty list when evaluation fails")
    void testEvaluateFailure() {
        when(alertService.evaluateCheckIns(anyList())).thenReturn(Flux.error(new RuntimeException("boom")));

        webTestClient.post()
            .uri("/evaluate")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("[{\"checkInId\": \"c-1\", \"subjectId\": \"s-001\", \"painLevel\": 2}]")
            .exchange()
            .expectStatus().is5xxServerError()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(0);
    }

    @Test
    @DisplayName("Should list alerts for a subject")
    void testGetAlerts() {
        Alert alert = new Alert(1L, "a-1", "s-001", "c-1", "highPain", "High pain alert",
            "Jordan Lee reported pain 9/10. Notify an admin to follow up.",
            LocalDateTime.parse("2025-08-01T12:00:00"), LocalDateTime.parse("2025-08-01T12:00:01"));
        when(alertService.getAlertsBySubjectId("s-001")).thenReturn(Flux.just(alert));

        webTestClient.get()
            .uri("/alerts?subjectId=s-001")
            .exchange()
            .expectStatus().isOk()
            .expectBodyList(Alert.class)
            .hasSize(1)
            .value(alerts -> assertThat(alerts.get(0).getReason()).isEqualTo("highPain"));
    }

    @Test
    @DisplayName("Should reject an alert query without a subject")
    void testGetAlertsWithoutSubject() {
        webTestClient.get()
            .uri("/alerts")
            .exchange()
            .expectStatus().isBadRequest();

        verifyNoInteractions(alertService);
    }

    @Test
    @DisplayName("Should clear the alert inbox")
    void testClearAlerts() {
        when(alertService.clearAllAlerts()).thenReturn(Mono.empty());

        webTestClient.delete()
            .uri("/alerts/clear")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("All alerts data cleared");
    }

    @Test
    @DisplayName("Health endpoint should report the service as running")
    void testHealth() {
        webTestClient.get()
            .uri("/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("Alert Service is running");
    }
}

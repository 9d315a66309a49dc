package com.careline.alert.controller;

import com.careline.alert.model.Alert;
import com.careline.alert.model.AlertNotification;
import com.careline.alert.model.CheckInRecord;
import com.careline.alert.service.AlertService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@Tag(name = "Escalation Alerts", description = "API for evaluating check-ins and reading the staff alert inbox")
public class AlertController {

    private static final Logger logger = LoggerFactory.getLogger(AlertController.class);

    private final AlertService alertService;

    public AlertController(AlertService alertService) {
        this.alertService = alertService;
    }

    @PostMapping("/evaluate")
    @Operation(summary = "Evaluate check-ins",
               description = "Receives check-ins from the Check-in Service and runs escalation rules with per-reason cooldown")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Check-ins evaluated, returning the alerts dispatched"),
        @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    public Mono<ResponseEntity<List<AlertNotification>>> evaluateCheckIns(@RequestBody List<CheckInRecord> checkIns) {
        logger.info("Received {} check-ins for evaluation", checkIns.size());

        return alertService.evaluateCheckIns(checkIns)
            .collectList()
            .map(alerts -> {
                logger.info("Dispatched {} alerts from {} check-ins", alerts.size(), checkIns.size());
                return ResponseEntity.ok(alerts);
            })
            .onErrorResume(error -> {
                logger.error("Error evaluating check-ins: {}", error.getMessage());
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(List.of()));
            });
    }

    @GetMapping("/alerts")
    @Operation(summary = "Get alerts for subject",
               description = "Retrieves the alert inbox for a subject, most recent first")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Alerts retrieved successfully",
                    content = @Content(schema = @Schema(implementation = Alert.class))),
        @ApiResponse(responseCode = "400", description = "Missing subject ID")
    })
    public Flux<Alert> getAlerts(
            @Parameter(description = "Subject ID to retrieve alerts for", required = true)
            @RequestParam(required = false) String subjectId) {
        if (subjectId == null || subjectId.trim().isEmpty()) {
            logger.error("Invalid subject ID provided");
            return Flux.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "subjectId is required"));
        }

        return alertService.getAlertsBySubjectId(subjectId)
            .doOnComplete(() -> logger.info("Completed fetching alerts for subject: {}", subjectId))
            .doOnError(error -> logger.error("Error fetching alerts for subject {}: {}", subjectId, error.getMessage()));
    }

    @DeleteMapping("/alerts/clear")
    @Operation(summary = "Clear alert inbox",
               description = "Removes all stored alerts - useful for testing. Cooldown state is kept.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "All alerts cleared successfully"),
        @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    public Mono<ResponseEntity<String>> clearAllAlerts() {
        logger.info("Clearing all alerts data");

        return alertService.clearAllAlerts()
            .then(Mono.just(ResponseEntity.ok("All alerts data cleared")))
            .onErrorResume(error -> {
                logger.error("Error clearing alerts: {}", error.getMessage());
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Error clearing alerts: " + error.getMessage()));
            });
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check if the Alert Service is running")
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("Alert Service is running"));
    }
}

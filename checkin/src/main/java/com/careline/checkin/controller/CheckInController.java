package com.careline.checkin.controller;

import com.careline.checkin.exception.SubjectNotFoundException;
import com.careline.checkin.model.CheckInRecord;
import com.careline.checkin.service.CheckInService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

@RestController
@Tag(name = "Check-ins", description = "API for submitting patient check-ins")
public class CheckInController {

    private static final Logger logger = LoggerFactory.getLogger(CheckInController.class);

    private final CheckInService checkInService;

    public CheckInController(CheckInService checkInService) {
        this.checkInService = checkInService;
    }

    @PostMapping("/checkins")
    @Operation(summary = "Submit a check-in",
               description = "Validates and stores a check-in, then forwards it to the alert service for escalation review without waiting for the result")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Check-in stored (or already stored with this id)"),
        @ApiResponse(responseCode = "400", description = "Invalid check-in data"),
        @ApiResponse(responseCode = "404", description = "Unknown subject"),
        @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    public Mono<ResponseEntity<CheckInRecord>> submitCheckIn(@RequestBody CheckInRecord checkIn) {
        logger.info("Received check-in for subject {}", checkIn.getSubjectId());

        return checkInService.submitCheckIn(checkIn)
            .map(ResponseEntity::ok)
            .onErrorResume(error -> {
                logger.error("Error submitting check-in: {}", error.getMessage());
                if (error instanceof ResponseStatusException) {
                    return Mono.error(error);
                }
                if (error instanceof SubjectNotFoundException) {
                    return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).<CheckInRecord>build());
                }
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).<CheckInRecord>build());
            });
    }

    @DeleteMapping("/checkins/clear")
    @Operation(summary = "Clear all check-in data",
               description = "Removes all stored check-ins and subjects - useful for testing")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "All data cleared successfully"),
        @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    public Mono<ResponseEntity<String>> clearAllData() {
        logger.info("Clearing all check-in data");

        return checkInService.clearAllData()
            .then(Mono.just(ResponseEntity.ok("All check-in data cleared")))
            .onErrorResume(error -> {
                logger.error("Error clearing data: {}", error.getMessage());
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Error clearing data: " + error.getMessage()));
            });
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check if the Check-in Service is running")
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("Check-in Service is running"));
    }
}

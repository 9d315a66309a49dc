package com.careline.checkin.controller;

import com.careline.checkin.exception.HistoryUnavailableException;
import com.careline.checkin.exception.SubjectNotFoundException;
import com.careline.checkin.guidance.GuidanceService;
import com.careline.checkin.model.*;
import com.careline.checkin.service.CheckInService;
import com.careline.checkin.trend.TrendComputer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

@RestController
@RequestMapping("/subjects")
@Tag(name = "Subjects", description = "API for subjects, their check-in history and trends")
public class SubjectController {

    private static final Logger logger = LoggerFactory.getLogger(SubjectController.class);

    private final CheckInService checkInService;
    private final TrendComputer trendComputer;
    private final GuidanceService guidanceService;

    @Value("${trends.default-window-days:30}")
    private int defaultWindowDays = 30;

    @Value("${trends.default-max-records:250}")
    private int defaultMaxRecords = 250;

    public SubjectController(CheckInService checkInService, TrendComputer trendComputer,
                             GuidanceService guidanceService) {
        this.checkInService = checkInService;
        this.trendComputer = trendComputer;
        this.guidanceService = guidanceService;
    }

    @PostMapping
    @Operation(summary = "Register a subject", description = "Creates a subject; an existing id returns the stored subject")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Subject registered"),
        @ApiResponse(responseCode = "400", description = "Missing display name")
    })
    public Mono<ResponseEntity<Subject>> registerSubject(@RequestBody Subject subject) {
        return checkInService.registerSubject(subject)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{subjectId}")
    @Operation(summary = "Get a subject")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Subject found"),
        @ApiResponse(responseCode = "404", description = "Unknown subject")
    })
    public Mono<ResponseEntity<Subject>> getSubject(@PathVariable String subjectId) {
        return checkInService.getSubject(subjectId)
            .map(ResponseEntity::ok)
            .onErrorResume(error -> failure(subjectId, error));
    }

    @GetMapping("/{subjectId}/checkins")
    @Operation(summary = "Get check-in history",
               description = "Returns check-ins for a subject, newest first, optionally filtered by date range and symptom/concern keyword")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "History retrieved"),
        @ApiResponse(responseCode = "404", description = "Unknown subject"),
        @ApiResponse(responseCode = "503", description = "History could not be loaded")
    })
    public Mono<ResponseEntity<List<CheckInRecord>>> getHistory(
            @PathVariable String subjectId,
            @Parameter(description = "Inclusive lower bound (ISO-8601 instant)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @Parameter(description = "Inclusive upper bound (ISO-8601 instant)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @Parameter(description = "Keyword matched against symptoms or concerns")
            @RequestParam(required = false) String keyword,
            @Parameter(description = "Maximum number of records")
            @RequestParam(required = false) Integer limit) {
        CheckInHistoryFilter filter = CheckInHistoryFilter.builder()
            .startDate(start)
            .endDate(end)
            .keyword(keyword)
            .limit(limit)
            .build();

        return checkInService.getHistory(subjectId, filter)
            .map(ResponseEntity::ok)
            .onErrorResume(error -> failure(subjectId, error));
    }

    @GetMapping("/{subjectId}/trends")
    @Operation(summary = "Get check-in trends",
               description = "Pain series, energy/mood/daypart distributions and symptom category counts over a lookback window")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Trends computed",
                    content = @Content(schema = @Schema(implementation = TrendResult.class))),
        @ApiResponse(responseCode = "400", description = "Unknown time zone"),
        @ApiResponse(responseCode = "404", description = "Unknown subject"),
        @ApiResponse(responseCode = "503", description = "History could not be loaded")
    })
    public Mono<ResponseEntity<TrendResult>> getTrends(
            @PathVariable String subjectId,
            @Parameter(description = "Lookback window in days (minimum 1)")
            @RequestParam(required = false) Integer windowDays,
            @Parameter(description = "Maximum records considered, newest first")
            @RequestParam(required = false) Integer maxRecords,
            @Parameter(description = "Time zone for day buckets, e.g. America/Chicago")
            @RequestParam(defaultValue = "UTC") String zone) {
        ZoneId zoneId;
        try {
            zoneId = ZoneId.of(zone);
        } catch (DateTimeException e) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown zone: " + zone));
        }

        int days = windowDays == null ? defaultWindowDays : windowDays;
        int max = maxRecords == null ? defaultMaxRecords : maxRecords;
        logger.info("Computing trends for subject {} (windowDays={}, maxRecords={}, zone={})",
            subjectId, days, max, zoneId);

        return trendComputer.computeTrends(subjectId, days, max, zoneId)
            .map(ResponseEntity::ok)
            .onErrorResume(error -> failure(subjectId, error));
    }

    @GetMapping("/{subjectId}/latest")
    @Operation(summary = "Get latest check-in summary",
               description = "Fields of the subject's newest check-in, derived from history on each call")
    public Mono<ResponseEntity<LatestCheckInSummary>> getLatest(@PathVariable String subjectId) {
        return checkInService.getLatestSummary(subjectId)
            .map(ResponseEntity::ok)
            .onErrorResume(error -> failure(subjectId, error));
    }

    @GetMapping("/{subjectId}/guidance")
    @Operation(summary = "Get self-care guidance",
               description = "Tips matching the symptom and concern categories of the newest check-in")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Tips found, possibly none"),
        @ApiResponse(responseCode = "404", description = "Unknown subject"),
        @ApiResponse(responseCode = "503", description = "History could not be loaded")
    })
    public Mono<ResponseEntity<List<GuidanceTip>>> getGuidance(@PathVariable String subjectId) {
        return guidanceService.guidanceFor(subjectId)
            .map(ResponseEntity::ok)
            .onErrorResume(error -> failure(subjectId, error));
    }

    private <T> Mono<ResponseEntity<T>> failure(String subjectId, Throwable error) {
        if (error instanceof SubjectNotFoundException) {
            logger.warn("Subject {} not found", subjectId);
            return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).build());
        }
        if (error instanceof HistoryUnavailableException) {
            logger.error("History unavailable for subject {}: {}", subjectId, error.getMessage());
            return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
        }
        return Mono.error(error);
    }
}

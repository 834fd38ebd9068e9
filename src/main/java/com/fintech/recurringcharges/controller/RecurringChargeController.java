package com.fintech.recurringcharges.controller;

import com.fintech.recurringcharges.dto.ChargePrediction;
import com.fintech.recurringcharges.dto.CriteriaSuggestion;
import com.fintech.recurringcharges.dto.DetectionResult;
import com.fintech.recurringcharges.dto.PatternCriteriaValidation;
import com.fintech.recurringcharges.dto.PatternReviewAction;
import com.fintech.recurringcharges.dto.ReviewOutcome;
import com.fintech.recurringcharges.dto.StatusChangeRequest;
import com.fintech.recurringcharges.entity.PatternStatus;
import com.fintech.recurringcharges.entity.RecurringChargePattern;
import com.fintech.recurringcharges.model.Transaction;
import com.fintech.recurringcharges.scheduler.DetectionScheduler;
import com.fintech.recurringcharges.service.PatternReviewService;
import com.fintech.recurringcharges.service.RecurringChargePatternService;
import com.fintech.recurringcharges.service.RecurringChargePatternService.PatternStats;
import com.fintech.recurringcharges.service.RecurringChargePredictionService;
import com.fintech.recurringcharges.service.TransactionHistoryClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * REST API for recurring charge detection and review.
 * <p>
 * Provides endpoints for:
 * - Triggering detection for a user
 * - Listing and inspecting detected patterns
 * - Validating criteria, reviewing, activating, pausing and resuming patterns
 * - Predicting upcoming charges
 */
@RestController
@RequestMapping("/api/v1/recurring-charges")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Recurring Charges", description = "Recurring charge detection and review API")
public class RecurringChargeController {

    private final RecurringChargePatternService patternService;
    private final PatternReviewService reviewService;
    private final RecurringChargePredictionService predictionService;
    private final TransactionHistoryClient transactionHistoryClient;
    private final DetectionScheduler detectionScheduler;

    @Operation(
            summary = "Detect recurring charges for a user",
            description = "Runs detection over the user's transaction history and saves new draft patterns in DETECTED status."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Detection completed",
                    content = @Content(schema = @Schema(implementation = DetectionResult.class))),
            @ApiResponse(responseCode = "503", description = "Transaction history unavailable")
    })
    @PostMapping("/users/{userId}/detect")
    public ResponseEntity<DetectionResult> detect(@Parameter(description = "User ID") @PathVariable String userId) {
        log.info("Detection triggered via API for user {}", userId);
        return ResponseEntity.ok(patternService.detectAndSave(userId));
    }

    @Operation(summary = "List a user's patterns", description = "Optionally filtered by status.")
    @ApiResponse(responseCode = "200", description = "Patterns retrieved successfully")
    @GetMapping("/users/{userId}/patterns")
    public ResponseEntity<List<RecurringChargePattern>> getPatterns(
            @Parameter(description = "User ID") @PathVariable String userId,
            @Parameter(description = "Status filter") @RequestParam(required = false) PatternStatus status) {
        return ResponseEntity.ok(patternService.getPatterns(userId, status));
    }

    @Operation(
            summary = "Patterns usable for categorization",
            description = "Returns only ACTIVE patterns with the active flag set."
    )
    @ApiResponse(responseCode = "200", description = "Patterns retrieved successfully")
    @GetMapping("/users/{userId}/patterns/active")
    public ResponseEntity<List<RecurringChargePattern>> getActivePatterns(
            @Parameter(description = "User ID") @PathVariable String userId) {
        return ResponseEntity.ok(patternService.getPatternsForCategorization(userId));
    }

    @Operation(summary = "Pattern counts by status")
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully",
            content = @Content(schema = @Schema(implementation = PatternStats.class)))
    @GetMapping("/users/{userId}/stats")
    public ResponseEntity<PatternStats> getStats(@Parameter(description = "User ID") @PathVariable String userId) {
        return ResponseEntity.ok(patternService.getStats(userId));
    }

    @Operation(summary = "Get pattern by ID")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Pattern found",
                    content = @Content(schema = @Schema(implementation = RecurringChargePattern.class))),
            @ApiResponse(responseCode = "404", description = "Pattern not found")
    })
    @GetMapping("/patterns/{id}")
    public ResponseEntity<RecurringChargePattern> getPattern(
            @Parameter(description = "Pattern ID") @PathVariable String id) {
        return ResponseEntity.ok(patternService.getPattern(id));
    }

    @Operation(
            summary = "Validate pattern criteria",
            description = "Replays the current criteria against the user's transactions and compares the matches with the original cluster."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Validation report",
                    content = @Content(schema = @Schema(implementation = PatternCriteriaValidation.class))),
            @ApiResponse(responseCode = "404", description = "Pattern not found")
    })
    @PostMapping("/patterns/{id}/validate")
    public ResponseEntity<PatternCriteriaValidation> validate(
            @Parameter(description = "Pattern ID") @PathVariable String id) {
        return ResponseEntity.ok(reviewService.revalidate(id));
    }

    @Operation(summary = "Review a pattern", description = "Confirm, reject or edit the criteria of a pattern.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Review applied",
                    content = @Content(schema = @Schema(implementation = ReviewOutcome.class))),
            @ApiResponse(responseCode = "404", description = "Pattern not found"),
            @ApiResponse(responseCode = "409", description = "Invalid transition or concurrent modification")
    })
    @PostMapping("/patterns/{id}/review")
    public ResponseEntity<ReviewOutcome> review(@Parameter(description = "Pattern ID") @PathVariable String id,
                                                @Valid @RequestBody PatternReviewAction action) {
        return ResponseEntity.ok(reviewService.review(id, action));
    }

    @Operation(summary = "Activate a confirmed pattern")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Pattern activated"),
            @ApiResponse(responseCode = "409", description = "Invalid transition or concurrent modification"),
            @ApiResponse(responseCode = "422", description = "Criteria have not been validated")
    })
    @PostMapping("/patterns/{id}/activate")
    public ResponseEntity<RecurringChargePattern> activate(@Parameter(description = "Pattern ID") @PathVariable String id,
                                                           @Valid @RequestBody StatusChangeRequest request) {
        return ResponseEntity.ok(reviewService.activate(id, request.getReviewerId(), request.getExpectedStatus()));
    }

    @Operation(summary = "Pause an active pattern")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Pattern paused"),
            @ApiResponse(responseCode = "409", description = "Invalid transition or concurrent modification")
    })
    @PostMapping("/patterns/{id}/pause")
    public ResponseEntity<RecurringChargePattern> pause(@Parameter(description = "Pattern ID") @PathVariable String id,
                                                        @Valid @RequestBody StatusChangeRequest request) {
        return ResponseEntity.ok(reviewService.pause(id, request.getReviewerId(), request.getExpectedStatus()));
    }

    @Operation(summary = "Resume a paused pattern")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Pattern resumed"),
            @ApiResponse(responseCode = "409", description = "Invalid transition or concurrent modification")
    })
    @PostMapping("/patterns/{id}/resume")
    public ResponseEntity<RecurringChargePattern> resume(@Parameter(description = "Pattern ID") @PathVariable String id,
                                                         @Valid @RequestBody StatusChangeRequest request) {
        return ResponseEntity.ok(reviewService.resume(id, request.getReviewerId(), request.getExpectedStatus()));
    }

    @Operation(
            summary = "Transactions matching the pattern",
            description = "Applies the criteria to the user's whole history, outside the detection window too."
    )
    @ApiResponse(responseCode = "200", description = "Matching transactions")
    @GetMapping("/patterns/{id}/matches")
    public ResponseEntity<List<Transaction>> getMatches(@Parameter(description = "Pattern ID") @PathVariable String id) {
        return ResponseEntity.ok(patternService.findMatchingTransactions(id));
    }

    @Operation(summary = "Criteria suggestions from the pattern's original transactions")
    @ApiResponse(responseCode = "200", description = "Suggestions",
            content = @Content(schema = @Schema(implementation = CriteriaSuggestion.class)))
    @GetMapping("/patterns/{id}/criteria-suggestions")
    public ResponseEntity<CriteriaSuggestion> getCriteriaSuggestions(
            @Parameter(description = "Pattern ID") @PathVariable String id) {
        return ResponseEntity.ok(patternService.suggestCriteria(id));
    }

    @Operation(summary = "Predict upcoming occurrences")
    @ApiResponse(responseCode = "200", description = "Predictions")
    @GetMapping("/patterns/{id}/predictions")
    public ResponseEntity<List<ChargePrediction>> predict(
            @Parameter(description = "Pattern ID") @PathVariable String id,
            @Parameter(description = "Number of occurrences") @RequestParam(defaultValue = "3") int count,
            @Parameter(description = "Reference date, defaults to today (UTC)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from) {
        if (count < 1 || count > 24) {
            throw new IllegalArgumentException("count must be between 1 and 24");
        }
        LocalDate fromDate = from != null ? from : LocalDate.now(ZoneOffset.UTC);
        return ResponseEntity.ok(predictionService.predictNext(patternService.getPattern(id), fromDate, count));
    }

    @Operation(
            summary = "Health check",
            description = "Returns the health status of the detection service. Used by load balancers and monitoring systems."
    )
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = Map.of(
                "status", "UP",
                "detection", Map.of(
                        "schedulerRunning", detectionScheduler.isRunning(),
                        "transactionSource", transactionHistoryClient.getSourceName(),
                        "transactionSourceAvailable", transactionHistoryClient.isAvailable()
                )
        );
        return ResponseEntity.ok(health);
    }
}

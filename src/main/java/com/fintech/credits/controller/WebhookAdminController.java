package com.fintech.credits.controller;

import com.fintech.credits.dto.RetrySweepResult;
import com.fintech.credits.entity.WebhookEvent;
import com.fintech.credits.service.WebhookEventStore;
import com.fintech.credits.service.WebhookRetryService;
import com.fintech.credits.service.WebhookRetryService.WebhookStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Operational endpoints for the webhook retry state machine.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Webhook administration", description = "Webhook retry inspection and control API")
public class WebhookAdminController {

    private final WebhookEventStore eventStore;
    private final WebhookRetryService retryService;

    @Operation(
            summary = "Get events due for retry",
            description = "Returns PENDING and FAILED events whose next retry time has passed, oldest first."
    )
    @ApiResponse(responseCode = "200", description = "Due events retrieved successfully")
    @GetMapping("/events/pending")
    public ResponseEntity<List<WebhookEvent>> getPendingEvents(
            @Parameter(description = "Maximum number of events") @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(eventStore.getPendingEvents(Math.min(limit, 500)));
    }

    @Operation(
            summary = "Get webhook statistics",
            description = "Counts of stored events per processing status, plus events that exhausted their retries."
    )
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully",
            content = @Content(schema = @Schema(implementation = WebhookStats.class)))
    @GetMapping("/stats")
    public ResponseEntity<WebhookStats> getStats() {
        return ResponseEntity.ok(retryService.getStats());
    }

    @Operation(
            summary = "Trigger a retry sweep",
            description = "Runs one retry sweep immediately. Useful after an outage or a plan catalog sync."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Sweep completed",
                    content = @Content(schema = @Schema(implementation = RetrySweepResult.class))),
            @ApiResponse(responseCode = "409", description = "Sweep already in progress")
    })
    @PostMapping("/retry/run")
    public ResponseEntity<RetrySweepResult> runRetrySweep() {
        log.info("Manual webhook retry sweep triggered via API");
        return ResponseEntity.ok(retryService.runSweep());
    }
}

package com.fintech.credits.controller;

import com.fintech.credits.dto.AllocateCreditsRequest;
import com.fintech.credits.dto.BalanceResponse;
import com.fintech.credits.dto.LedgerConsistencyReport;
import com.fintech.credits.dto.LedgerOperationResponse;
import com.fintech.credits.dto.LedgerResult;
import com.fintech.credits.dto.TransactionHistoryPage;
import com.fintech.credits.dto.UseCreditsRequest;
import com.fintech.credits.entity.CreditTransactionType;
import com.fintech.credits.service.CreditLedgerService;
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
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST API for credit balances and the ledger.
 */
@RestController
@RequestMapping("/api/v1/credits/{subjectId}")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Credits", description = "Credit balance and ledger operations API")
public class CreditController {

    private final CreditLedgerService ledgerService;

    @Operation(
            summary = "Get balance",
            description = "Returns the current balance for the subject and provider. A subject without a balance row has a zero balance."
    )
    @ApiResponse(responseCode = "200", description = "Balance retrieved successfully",
            content = @Content(schema = @Schema(implementation = BalanceResponse.class)))
    @GetMapping("/balance")
    public ResponseEntity<BalanceResponse> getBalance(
            @Parameter(description = "Subject ID") @PathVariable UUID subjectId,
            @Parameter(description = "Ledger provider tag") @RequestParam String provider) {
        return ResponseEntity.ok(BalanceResponse.from(ledgerService.getBalance(subjectId, provider)));
    }

    @Operation(
            summary = "Use credits",
            description = "Debits credits for a feature. Rejected with 402 and the shortfall when the balance is too low. A repeated idempotency key returns the original transaction."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Credits debited, or replayed",
                    content = @Content(schema = @Schema(implementation = LedgerOperationResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "402", description = "Insufficient balance"),
            @ApiResponse(responseCode = "404", description = "No balance for this subject and provider")
    })
    @PostMapping("/usage")
    public ResponseEntity<LedgerOperationResponse> useCredits(
            @Parameter(description = "Subject ID") @PathVariable UUID subjectId,
            @Valid @RequestBody UseCreditsRequest request) {
        LedgerResult result = ledgerService.useCredits(subjectId, request.getProvider(), request.getAmount(),
                request.getDescription(), request.getFeatureName(), request.getIdempotencyKey());
        return ResponseEntity.ok(LedgerOperationResponse.from(result));
    }

    @Operation(
            summary = "Allocate credits",
            description = "System-driven grant. A repeated reference id returns the original transaction instead of crediting again."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Credits allocated",
                    content = @Content(schema = @Schema(implementation = LedgerOperationResponse.class))),
            @ApiResponse(responseCode = "200", description = "Reference already recorded, original returned"),
            @ApiResponse(responseCode = "400", description = "Invalid request, or reference recorded for another subject or provider")
    })
    @PostMapping("/allocations")
    public ResponseEntity<LedgerOperationResponse> allocateCredits(
            @Parameter(description = "Subject ID") @PathVariable UUID subjectId,
            @Valid @RequestBody AllocateCreditsRequest request) {
        log.info("Manual allocation of {} credits to subject {} on {} requested",
                request.getAmount(), subjectId, request.getProvider());
        LedgerResult result = ledgerService.allocateCredits(subjectId, request.getProvider(), request.getAmount(),
                request.getDescription(), request.getReferenceId());
        return ResponseEntity.status(result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED)
                .body(LedgerOperationResponse.from(result));
    }

    @Operation(
            summary = "Get transaction history",
            description = "Returns ledger entries, most recent first. Limit defaults to 20 and is capped at 100."
    )
    @ApiResponse(responseCode = "200", description = "History retrieved successfully",
            content = @Content(schema = @Schema(implementation = TransactionHistoryPage.class)))
    @GetMapping("/transactions")
    public ResponseEntity<TransactionHistoryPage> getTransactions(
            @Parameter(description = "Subject ID") @PathVariable UUID subjectId,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int limit,
            @Parameter(description = "Rows to skip") @RequestParam(defaultValue = "0") int offset,
            @Parameter(description = "Transaction type filter") @RequestParam(required = false) CreditTransactionType type,
            @Parameter(description = "Ledger provider tag filter") @RequestParam(required = false) String provider) {
        return ResponseEntity.ok(ledgerService.getTransactionHistoryPage(subjectId, provider, type, limit, offset));
    }

    @Operation(
            summary = "Verify ledger consistency",
            description = "Compares the cached balance with the sum of ledger entries and the latest balance snapshot."
    )
    @ApiResponse(responseCode = "200", description = "Consistency report",
            content = @Content(schema = @Schema(implementation = LedgerConsistencyReport.class)))
    @GetMapping("/consistency")
    public ResponseEntity<LedgerConsistencyReport> verifyConsistency(
            @Parameter(description = "Subject ID") @PathVariable UUID subjectId,
            @Parameter(description = "Ledger provider tag") @RequestParam String provider) {
        return ResponseEntity.ok(ledgerService.verifyConsistency(subjectId, provider));
    }
}

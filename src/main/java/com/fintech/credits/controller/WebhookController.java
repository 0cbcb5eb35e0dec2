package com.fintech.credits.controller;

import com.fintech.credits.dto.WebhookAck;
import com.fintech.credits.service.WebhookProcessingService;
import com.fintech.credits.service.provider.StripeWebhookAdapter;
import com.fintech.credits.service.provider.TossWebhookAdapter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Payment provider webhook endpoints. Bodies are taken as raw bytes: signatures are computed over
 * the exact bytes sent.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Payment provider notification endpoints")
public class WebhookController {

    private final WebhookProcessingService processingService;

    @Operation(summary = "Receive a Stripe event")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Accepted (including replays and internally retried failures)",
                    content = @Content(schema = @Schema(implementation = WebhookAck.class))),
            @ApiResponse(responseCode = "400", description = "Signature or payload rejected")
    })
    @PostMapping("/stripe")
    public ResponseEntity<WebhookAck> stripe(
            @RequestBody byte[] payload,
            @RequestHeader(value = "Stripe-Signature", required = false) String signature) {
        return ResponseEntity.ok(processingService.receive(StripeWebhookAdapter.PROVIDER_NAME, payload, signature));
    }

    @Operation(summary = "Receive a TossPayments event")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Accepted (including replays and internally retried failures)",
                    content = @Content(schema = @Schema(implementation = WebhookAck.class))),
            @ApiResponse(responseCode = "400", description = "Signature or payload rejected")
    })
    @PostMapping("/toss")
    public ResponseEntity<WebhookAck> toss(
            @RequestBody byte[] payload,
            @RequestHeader(value = "X-Toss-Signature", required = false) String signature) {
        return ResponseEntity.ok(processingService.receive(TossWebhookAdapter.PROVIDER_NAME, payload, signature));
    }
}

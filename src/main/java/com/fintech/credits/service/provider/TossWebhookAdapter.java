package com.fintech.credits.service.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.credits.dto.NormalizedEvent;
import com.fintech.credits.dto.NormalizedEvent.SubjectCandidates;
import com.fintech.credits.entity.CanonicalStatus;
import com.fintech.credits.entity.EventCategory;
import com.fintech.credits.exception.ProviderVerificationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;

import static com.fintech.credits.service.provider.JsonFields.firstNonNull;
import static com.fintech.credits.service.provider.JsonFields.integer;
import static com.fintech.credits.service.provider.JsonFields.isoDateTime;
import static com.fintech.credits.service.provider.JsonFields.path;
import static com.fintech.credits.service.provider.JsonFields.text;

/**
 * TossPayments webhook adapter.
 * <p>
 * Deliveries carry {@code X-Toss-Signature}: the hex HMAC-SHA256 of the raw body keyed with the
 * webhook secret. Body shape:
 * <pre>
 * {"eventType": "PAYMENT_STATUS_CHANGED", "createdAt": "...",
 *  "data": {"orderId": "...", "paymentKey": "...", "status": "DONE", "metadata": {...}}}
 * </pre>
 * Toss has no event id of its own, so one is derived from order, status and transaction key.
 */
@Component
@Slf4j
public class TossWebhookAdapter implements PaymentProviderAdapter {

    public static final String PROVIDER_NAME = "toss";

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String webhookSecret;

    public TossWebhookAdapter(ObjectMapper objectMapper,
                              Clock clock,
                              @Value("${ledger.providers.toss.webhook-secret:}") String webhookSecret) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.webhookSecret = webhookSecret;
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    @Override
    public NormalizedEvent normalize(byte[] payload, String signature) {
        if (!StringUtils.hasText(webhookSecret)) {
            throw new ProviderVerificationException("Toss webhook secret is not configured", PROVIDER_NAME);
        }
        if (payload == null || payload.length == 0 || !StringUtils.hasText(signature)) {
            throw new ProviderVerificationException("Missing Toss payload or signature", PROVIDER_NAME);
        }

        String expected = HmacSignatures.hmacSha256Hex(webhookSecret, payload);
        if (!HmacSignatures.signaturesMatch(expected, signature)) {
            log.warn("Rejected Toss webhook: signature mismatch");
            throw new ProviderVerificationException("Toss signature mismatch", PROVIDER_NAME);
        }

        return parse(new String(payload, StandardCharsets.UTF_8));
    }

    @Override
    public NormalizedEvent parse(String trustedPayload) {
        JsonNode root = readTree(trustedPayload);
        JsonNode data = path(root, "data");

        String orderId = text(data, "orderId");
        String status = text(data, "status");
        if (orderId == null || status == null) {
            throw new ProviderVerificationException("Toss event is missing data.orderId or data.status",
                    PROVIDER_NAME);
        }

        String eventType = firstNonNull(text(root, "eventType"), "PAYMENT_STATUS_CHANGED");
        String createdAt = text(root, "createdAt");
        String discriminator = firstNonNull(
                text(data, "transactionKey"),
                text(data, "lastTransactionKey"),
                createdAt,
                text(data, "approvedAt"),
                "none");

        CanonicalStatus canonicalStatus = mapStatus(status);
        if (canonicalStatus == null) {
            log.warn("Unknown Toss payment status {} for order {}", status, orderId);
        }

        return NormalizedEvent.builder()
                .provider(PROVIDER_NAME)
                .eventId(eventId(orderId, status, discriminator))
                .eventType(eventType)
                .category(EventCategory.PAYMENT)
                .canonicalStatus(canonicalStatus)
                .providerPaymentRef(orderId)
                .providerTxnRef(text(data, "paymentKey"))
                .providerCustomerId(firstNonNull(text(data, "customerKey"), text(data, "metadata", "customer_key")))
                .customerEmail(firstNonNull(text(data, "customerEmail"), text(data, "metadata", "email")))
                .priceId(text(data, "metadata", "plan_id"))
                .productName(text(data, "orderName"))
                .metadataCredits(integer(data, "metadata", "credits"))
                .serviceProvider(text(data, "metadata", "service_provider"))
                .rawData(data)
                .receivedAt(orElse(isoDateTime(root, clock.getZone(), "createdAt"), LocalDateTime.now(clock)))
                .subjectCandidates(SubjectCandidates.builder()
                        .direct(text(data, "metadata", "user_id"))
                        .nested(text(data, "metadata", "customer_key"))
                        .lineItem(text(data, "customerKey"))
                        .build())
                .build();
    }

    static CanonicalStatus mapStatus(String status) {
        if (status == null) {
            return null;
        }
        return switch (status) {
            case "DONE" -> CanonicalStatus.COMPLETED;
            case "CANCELED" -> CanonicalStatus.CANCELED;
            case "PARTIAL_CANCELED" -> CanonicalStatus.REFUNDED;
            case "EXPIRED", "ABORTED" -> CanonicalStatus.FAILED;
            default -> null;
        };
    }

    static String eventId(String orderId, String status, String discriminator) {
        return PROVIDER_NAME + ":" + orderId + ":" + status + ":" + discriminator;
    }

    private JsonNode readTree(String payload) {
        try {
            JsonNode root = objectMapper.readTree(payload);
            if (root == null || !root.isObject()) {
                throw new ProviderVerificationException("Toss payload is not a JSON object", PROVIDER_NAME);
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ProviderVerificationException("Malformed Toss payload: " + e.getOriginalMessage(),
                    PROVIDER_NAME, e);
        }
    }

    private static <T> T orElse(T first, T second) {
        return first != null ? first : second;
    }
}

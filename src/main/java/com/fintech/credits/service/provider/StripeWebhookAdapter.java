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

import static com.fintech.credits.service.provider.JsonFields.epochSeconds;
import static com.fintech.credits.service.provider.JsonFields.firstElement;
import static com.fintech.credits.service.provider.JsonFields.firstNonNull;
import static com.fintech.credits.service.provider.JsonFields.idOrExpanded;
import static com.fintech.credits.service.provider.JsonFields.integer;
import static com.fintech.credits.service.provider.JsonFields.path;
import static com.fintech.credits.service.provider.JsonFields.text;

/**
 * Stripe webhook adapter.
 * <p>
 * Signature header format:
 * <pre>
 * Stripe-Signature: t=1614556800,v1=abc123...,v0=def456...
 * </pre>
 * The v1 signature is the hex HMAC-SHA256 of {@code t + "." + raw_body} keyed with the
 * endpoint secret. Deliveries whose timestamp is outside the tolerance window are rejected
 * to prevent replays.
 *
 * @see <a href="https://stripe.com/docs/webhooks/signatures">Stripe Webhook Signatures</a>
 */
@Component
@Slf4j
public class StripeWebhookAdapter implements PaymentProviderAdapter {

    public static final String PROVIDER_NAME = "stripe";

    static final String USER_ID = "user_id";
    static final String CREDITS_PER_CYCLE = "credits_per_cycle";
    static final String SERVICE_PROVIDER = "service_provider";

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String webhookSecret;
    private final long toleranceSeconds;

    public StripeWebhookAdapter(ObjectMapper objectMapper,
                                Clock clock,
                                @Value("${ledger.providers.stripe.webhook-secret:}") String webhookSecret,
                                @Value("${ledger.providers.stripe.tolerance-seconds:300}") long toleranceSeconds) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.webhookSecret = webhookSecret;
        this.toleranceSeconds = toleranceSeconds;
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    @Override
    public NormalizedEvent normalize(byte[] payload, String signature) {
        verifySignature(payload, signature);
        return parse(new String(payload, StandardCharsets.UTF_8));
    }

    @Override
    public NormalizedEvent parse(String trustedPayload) {
        JsonNode root = readTree(trustedPayload);

        String eventId = text(root, "id");
        String eventType = text(root, "type");
        JsonNode object = path(root, "data", "object");
        if (eventId == null || eventType == null || object == null || !object.isObject()) {
            throw new ProviderVerificationException("Stripe event is missing id, type or data.object", PROVIDER_NAME);
        }

        NormalizedEvent.NormalizedEventBuilder event = NormalizedEvent.builder()
                .provider(PROVIDER_NAME)
                .eventId(eventId)
                .eventType(eventType)
                .rawData(object)
                .receivedAt(LocalDateTime.now(clock));

        switch (eventType) {
            case "invoice.paid", "invoice.payment_succeeded" -> invoice(event, object, CanonicalStatus.COMPLETED);
            case "invoice.payment_failed" -> invoice(event, object, CanonicalStatus.FAILED);
            case "charge.refunded" -> refundedCharge(event, object);
            case "customer.subscription.created", "customer.subscription.updated" ->
                    subscription(event, object, mapSubscriptionStatus(text(object, "status")));
            case "customer.subscription.deleted" -> subscription(event, object, CanonicalStatus.CANCELED);
            case "setup_intent.succeeded" -> setupIntent(event, object);
            default -> {
                log.debug("Stripe event type {} carries no outcome", eventType);
                event.category(EventCategory.OTHER)
                        .providerCustomerId(idOrExpanded(object, "customer"))
                        .subjectCandidates(SubjectCandidates.builder()
                                .direct(text(object, "metadata", USER_ID))
                                .build());
            }
        }

        return event.build();
    }

    /**
     * Subscription status to canonical outcome. Statuses with no settled outcome map to null.
     */
    static CanonicalStatus mapSubscriptionStatus(String status) {
        if (status == null) {
            return null;
        }
        return switch (status) {
            case "active", "trialing" -> CanonicalStatus.COMPLETED;
            case "canceled", "unpaid", "incomplete_expired" -> CanonicalStatus.CANCELED;
            case "past_due", "incomplete" -> CanonicalStatus.FAILED;
            default -> null;
        };
    }

    private void invoice(NormalizedEvent.NormalizedEventBuilder event, JsonNode invoice, CanonicalStatus status) {
        JsonNode line = firstElement(invoice, "lines", "data");
        JsonNode price = firstNonNullNode(path(line, "price"), path(line, "pricing", "price_details"));
        JsonNode product = path(price, "product");

        event.category(EventCategory.PAYMENT)
                .canonicalStatus(status)
                .providerPaymentRef(text(invoice, "id"))
                .providerTxnRef(firstNonNull(
                        idOrExpanded(invoice, "payment_intent"),
                        idOrExpanded(invoice, "charge")))
                .providerCustomerId(idOrExpanded(invoice, "customer"))
                .customerEmail(firstNonNull(
                        text(invoice, "customer_email"),
                        text(invoice, "customer", "email")))
                .providerSubscriptionId(invoiceSubscriptionId(invoice, line))
                .priceId(firstNonNull(idOrExpanded(line, "price"), text(line, "pricing", "price_details", "price")))
                .productId(firstNonNull(
                        idOrExpanded(price, "product"),
                        text(line, "pricing", "price_details", "product")))
                .productName(firstNonNull(text(product, "name"), text(line, "description")))
                .metadataCredits(firstNonNullInt(
                        integer(product, "metadata", CREDITS_PER_CYCLE),
                        integer(price, "metadata", CREDITS_PER_CYCLE),
                        integer(line, "metadata", CREDITS_PER_CYCLE)))
                .serviceProvider(firstNonNull(
                        text(invoice, "metadata", SERVICE_PROVIDER),
                        text(invoice, "parent", "subscription_details", "metadata", SERVICE_PROVIDER),
                        text(line, "metadata", SERVICE_PROVIDER)))
                .currentPeriodEnd(epochSeconds(line, clock.getZone(), "period", "end"))
                .subjectCandidates(SubjectCandidates.builder()
                        .direct(text(invoice, "metadata", USER_ID))
                        .nested(firstNonNull(
                                text(invoice, "parent", "subscription_details", "metadata", USER_ID),
                                text(invoice, "subscription", "metadata", USER_ID),
                                text(invoice, "customer", "metadata", USER_ID)))
                        .lineItem(text(line, "metadata", USER_ID))
                        .build());
    }

    /**
     * Subscription id of an invoice, in order: top-level field (string or expanded),
     * parent item details, parent subscription details, first line item.
     */
    static String invoiceSubscriptionId(JsonNode invoice, JsonNode firstLine) {
        return firstNonNull(
                idOrExpanded(invoice, "subscription"),
                text(invoice, "parent", "subscription_item_details", "subscription"),
                text(invoice, "parent", "subscription_details", "subscription"),
                idOrExpanded(firstLine, "subscription"),
                text(firstLine, "parent", "subscription_item_details", "subscription"));
    }

    private void refundedCharge(NormalizedEvent.NormalizedEventBuilder event, JsonNode charge) {
        event.category(EventCategory.PAYMENT)
                .canonicalStatus(CanonicalStatus.REFUNDED)
                .providerPaymentRef(firstNonNull(idOrExpanded(charge, "invoice"), text(charge, "id")))
                .providerTxnRef(firstNonNull(idOrExpanded(charge, "payment_intent"), text(charge, "id")))
                .providerCustomerId(idOrExpanded(charge, "customer"))
                .customerEmail(text(charge, "billing_details", "email"))
                .subjectCandidates(SubjectCandidates.builder()
                        .direct(text(charge, "metadata", USER_ID))
                        .nested(text(charge, "customer", "metadata", USER_ID))
                        .build());
    }

    private void subscription(NormalizedEvent.NormalizedEventBuilder event, JsonNode subscription,
                              CanonicalStatus status) {
        JsonNode item = firstElement(subscription, "items", "data");
        JsonNode price = path(item, "price");

        LocalDateTime periodEnd = epochSeconds(subscription, clock.getZone(), "current_period_end");
        if (periodEnd == null) {
            periodEnd = epochSeconds(item, clock.getZone(), "current_period_end");
        }

        event.category(EventCategory.SUBSCRIPTION)
                .canonicalStatus(status)
                .providerSubscriptionId(text(subscription, "id"))
                .providerCustomerId(idOrExpanded(subscription, "customer"))
                .customerEmail(text(subscription, "customer", "email"))
                .subscriptionStatus(text(subscription, "status"))
                .priceId(idOrExpanded(item, "price"))
                .productId(idOrExpanded(price, "product"))
                .productName(text(price, "product", "name"))
                .metadataCredits(integer(price, "product", "metadata", CREDITS_PER_CYCLE))
                .serviceProvider(text(subscription, "metadata", SERVICE_PROVIDER))
                .currentPeriodEnd(periodEnd)
                .subjectCandidates(SubjectCandidates.builder()
                        .direct(text(subscription, "metadata", USER_ID))
                        .nested(text(subscription, "customer", "metadata", USER_ID))
                        .lineItem(text(item, "metadata", USER_ID))
                        .build());
    }

    private void setupIntent(NormalizedEvent.NormalizedEventBuilder event, JsonNode setupIntent) {
        event.category(EventCategory.CUSTOMER_SETUP)
                .canonicalStatus(CanonicalStatus.COMPLETED)
                .providerTxnRef(text(setupIntent, "id"))
                .providerCustomerId(idOrExpanded(setupIntent, "customer"))
                .customerEmail(firstNonNull(
                        text(setupIntent, "metadata", "email"),
                        text(setupIntent, "customer", "email")))
                .serviceProvider(text(setupIntent, "metadata", SERVICE_PROVIDER))
                .subjectCandidates(SubjectCandidates.builder()
                        .direct(text(setupIntent, "metadata", USER_ID))
                        .nested(text(setupIntent, "customer", "metadata", USER_ID))
                        .build());
    }

    private void verifySignature(byte[] payload, String signatureHeader) {
        if (!StringUtils.hasText(webhookSecret)) {
            throw new ProviderVerificationException("Stripe webhook secret is not configured", PROVIDER_NAME);
        }
        if (payload == null || payload.length == 0 || !StringUtils.hasText(signatureHeader)) {
            throw new ProviderVerificationException("Missing Stripe payload or signature", PROVIDER_NAME);
        }

        long timestamp = -1;
        String v1Signature = null;
        for (String part : signatureHeader.split(",")) {
            String[] keyValue = part.trim().split("=", 2);
            if (keyValue.length != 2) {
                continue;
            }
            if ("t".equals(keyValue[0])) {
                try {
                    timestamp = Long.parseLong(keyValue[1]);
                } catch (NumberFormatException e) {
                    throw new ProviderVerificationException("Malformed Stripe signature timestamp", PROVIDER_NAME, e);
                }
            } else if ("v1".equals(keyValue[0]) && v1Signature == null) {
                v1Signature = keyValue[1];
            }
        }

        if (timestamp == -1 || v1Signature == null) {
            throw new ProviderVerificationException("Stripe signature header lacks timestamp or v1 signature",
                    PROVIDER_NAME);
        }

        long now = clock.instant().getEpochSecond();
        if (Math.abs(now - timestamp) > toleranceSeconds) {
            log.warn("Rejected Stripe webhook: timestamp {} outside tolerance of {}s", timestamp, toleranceSeconds);
            throw new ProviderVerificationException("Stripe signature timestamp outside tolerance", PROVIDER_NAME);
        }

        byte[] prefix = (timestamp + ".").getBytes(StandardCharsets.UTF_8);
        byte[] signedPayload = new byte[prefix.length + payload.length];
        System.arraycopy(prefix, 0, signedPayload, 0, prefix.length);
        System.arraycopy(payload, 0, signedPayload, prefix.length, payload.length);

        String expected = HmacSignatures.hmacSha256Hex(webhookSecret, signedPayload);
        if (!HmacSignatures.signaturesMatch(expected, v1Signature)) {
            log.warn("Rejected Stripe webhook: signature mismatch");
            throw new ProviderVerificationException("Stripe signature mismatch", PROVIDER_NAME);
        }
    }

    private JsonNode readTree(String payload) {
        try {
            JsonNode root = objectMapper.readTree(payload);
            if (root == null || !root.isObject()) {
                throw new ProviderVerificationException("Stripe payload is not a JSON object", PROVIDER_NAME);
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ProviderVerificationException("Malformed Stripe payload: " + e.getOriginalMessage(),
                    PROVIDER_NAME, e);
        }
    }

    private static JsonNode firstNonNullNode(JsonNode first, JsonNode second) {
        return first != null && first.isObject() ? first : second;
    }

    private static Integer firstNonNullInt(Integer... values) {
        for (Integer value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}

package com.fintech.credits.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.credits.entity.CanonicalStatus;
import com.fintech.credits.entity.EventCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Provider-independent view of one webhook delivery.
 * <p>
 * Adapters fill in whatever the provider payload carries; everything except
 * provider, eventId, eventType and category is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormalizedEvent {

    /**
     * PSP name, e.g. {@code stripe} or {@code toss}.
     */
    private String provider;

    /**
     * Dedup key, unique per provider.
     */
    private String eventId;

    /**
     * Provider event type as delivered (e.g. {@code invoice.paid}).
     */
    private String eventType;

    private EventCategory category;

    /**
     * Null when the event carries no outcome; such events are acknowledged and ignored.
     */
    private CanonicalStatus canonicalStatus;

    @Builder.Default
    private SubjectCandidates subjectCandidates = SubjectCandidates.builder().build();

    /**
     * Payment identity used for allocation idempotency (invoice id, Toss order id).
     */
    private String providerPaymentRef;

    /**
     * Provider transaction id (charge / payment intent / Toss payment key).
     */
    private String providerTxnRef;

    private String providerCustomerId;
    private String providerSubscriptionId;
    private String priceId;
    private String productId;
    private String productName;

    /**
     * {@code credits_per_cycle} embedded in product metadata, if any.
     */
    private Integer metadataCredits;

    /**
     * Ledger provider tag override from payment metadata ({@code service_provider}).
     */
    private String serviceProvider;

    private String customerEmail;
    private String subscriptionStatus;
    private LocalDateTime currentPeriodEnd;

    /**
     * The provider's event object, parsed.
     */
    private JsonNode rawData;

    private LocalDateTime receivedAt;

    /**
     * Raw user-id strings found in the payload, in resolution order. Values are not
     * validated here; see {@code SubjectResolver}.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SubjectCandidates {
        /**
         * {@code metadata.user_id} on the event object.
         */
        private String direct;

        /**
         * Parent or expanded sub-object metadata (subscription details, subscription, customer).
         */
        private String nested;

        /**
         * First line item's {@code metadata.user_id}.
         */
        private String lineItem;
    }
}

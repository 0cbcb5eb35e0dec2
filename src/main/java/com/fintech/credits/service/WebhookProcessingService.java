package com.fintech.credits.service;

import com.fintech.credits.dto.CancellationResult;
import com.fintech.credits.dto.LedgerResult;
import com.fintech.credits.dto.NormalizedEvent;
import com.fintech.credits.dto.WebhookAck;
import com.fintech.credits.entity.CanonicalStatus;
import com.fintech.credits.entity.EventCategory;
import com.fintech.credits.entity.Subscription;
import com.fintech.credits.entity.WebhookEvent;
import com.fintech.credits.entity.WebhookProcessingStatus;
import com.fintech.credits.exception.NotFoundException;
import com.fintech.credits.exception.ProviderVerificationException;
import com.fintech.credits.exception.ValidationException;
import com.fintech.credits.service.provider.PaymentProviderAdapter;
import com.fintech.credits.service.provider.ProviderAdapterRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for provider notifications: verify, store, dispatch, record the outcome.
 * <p>
 * Dispatch switches on the canonical status and event category only, never on
 * provider-specific strings. A handler failure is recorded on the stored event and the
 * delivery is still acknowledged: the PSP must not redeliver, the retry sweeper owns the retry.
 * Only unverifiable or malformed deliveries are rejected.
 * <p>
 * A delivery claims its stored event (PENDING/FAILED to PROCESSING) before applying it, the same
 * claim the retry sweeper takes, so one event is never applied by both at once.
 */
@Service
@Slf4j
public class WebhookProcessingService {

    private final ProviderAdapterRegistry adapterRegistry;
    private final WebhookEventStore eventStore;
    private final CreditLedgerService ledgerService;
    private final SubscriptionReconciler subscriptionReconciler;
    private final SubscriptionService subscriptionService;
    private final CustomerMappingService customerMappingService;
    private final PlanCatalogService planCatalogService;
    private final SubjectResolver subjectResolver;
    private final MeterRegistry meterRegistry;
    private final String defaultServiceProvider;

    // Metrics
    private Counter receivedCounter;
    private Counter rejectedCounter;
    private Counter duplicateCounter;
    private Counter processedCounter;
    private Counter failedCounter;
    private Counter unresolvedSubjectCounter;
    private Counter canceledSubscriptionCounter;

    public WebhookProcessingService(ProviderAdapterRegistry adapterRegistry,
                                    WebhookEventStore eventStore,
                                    CreditLedgerService ledgerService,
                                    SubscriptionReconciler subscriptionReconciler,
                                    SubscriptionService subscriptionService,
                                    CustomerMappingService customerMappingService,
                                    PlanCatalogService planCatalogService,
                                    SubjectResolver subjectResolver,
                                    MeterRegistry meterRegistry,
                                    @Value("${ledger.default-service-provider:semo}") String defaultServiceProvider) {
        this.adapterRegistry = adapterRegistry;
        this.eventStore = eventStore;
        this.ledgerService = ledgerService;
        this.subscriptionReconciler = subscriptionReconciler;
        this.subscriptionService = subscriptionService;
        this.customerMappingService = customerMappingService;
        this.planCatalogService = planCatalogService;
        this.subjectResolver = subjectResolver;
        this.meterRegistry = meterRegistry;
        this.defaultServiceProvider = defaultServiceProvider;
    }

    @PostConstruct
    public void initMetrics() {
        receivedCounter = Counter.builder("ledger.webhooks.received")
                .description("Verified webhook deliveries")
                .register(meterRegistry);

        rejectedCounter = Counter.builder("ledger.webhooks.rejected")
                .description("Webhook deliveries rejected by signature or parse checks")
                .register(meterRegistry);

        duplicateCounter = Counter.builder("ledger.webhooks.duplicates")
                .description("Redeliveries of already processed events")
                .register(meterRegistry);

        processedCounter = Counter.builder("ledger.webhooks.processed")
                .description("Webhook events applied successfully")
                .register(meterRegistry);

        failedCounter = Counter.builder("ledger.webhooks.failed")
                .description("Webhook event attempts that raised an error")
                .register(meterRegistry);

        unresolvedSubjectCounter = Counter.builder("ledger.webhooks.unresolved_subject")
                .description("Payment events skipped because no subject could be resolved")
                .register(meterRegistry);

        canceledSubscriptionCounter = Counter.builder("ledger.webhooks.canceled_subscription_payments")
                .description("Payment events skipped because their subscription was already canceled")
                .register(meterRegistry);
    }

    /**
     * Handle one delivery.
     *
     * @param provider  PSP name from the endpoint
     * @param payload   raw request body
     * @param signature provider signature header
     * @throws ProviderVerificationException if the delivery cannot be verified or parsed;
     *                                       nothing is stored in that case
     */
    public WebhookAck receive(String provider, byte[] payload, String signature) {
        NormalizedEvent event;
        try {
            PaymentProviderAdapter adapter = adapterRegistry.get(provider);
            event = adapter.normalize(payload, signature);
        } catch (ProviderVerificationException e) {
            rejectedCounter.increment();
            log.warn("Rejected {} webhook: {}", provider, e.getMessage());
            throw e;
        }

        receivedCounter.increment();
        log.info("Received {} webhook {} ({}), canonical status {}",
                event.getProvider(), event.getEventId(), event.getEventType(), event.getCanonicalStatus());

        boolean stored = eventStore.saveEvent(event.getProvider(), event.getEventId(), event.getEventType(),
                event.getCanonicalStatus(), new String(payload, StandardCharsets.UTF_8));

        WebhookEvent row = eventStore.getEvent(event.getProvider(), event.getEventId())
                .orElseThrow(() -> new NotFoundException("Webhook event",
                        event.getProvider() + "/" + event.getEventId()));

        if (!stored) {
            WebhookProcessingStatus existingStatus = row.getStatus();
            if (existingStatus == WebhookProcessingStatus.COMPLETED
                    || existingStatus == WebhookProcessingStatus.PROCESSING) {
                duplicateCounter.increment();
                log.info("Webhook {}/{} already {}, acknowledging redelivery",
                        event.getProvider(), event.getEventId(), existingStatus);
                return ack(event, existingStatus, true, "Already " + existingStatus.name().toLowerCase());
            }
            log.info("Webhook {}/{} redelivered while {}, processing again",
                    event.getProvider(), event.getEventId(), existingStatus);
        }

        if (!eventStore.claim(row)) {
            duplicateCounter.increment();
            log.info("Webhook {}/{} claimed by the retry sweeper, acknowledging delivery",
                    event.getProvider(), event.getEventId());
            return ack(event, WebhookProcessingStatus.PROCESSING, true, "Already processing");
        }

        WebhookProcessingStatus outcome = apply(event);
        return ack(event, outcome, false,
                outcome == WebhookProcessingStatus.COMPLETED ? "Processed" : "Processing failed, will retry");
    }

    /**
     * Dispatch a stored event and record the outcome on it. Never throws for handler errors:
     * they end up in the event's lastError and retry schedule.
     *
     * @return COMPLETED or FAILED
     */
    public WebhookProcessingStatus apply(NormalizedEvent event) {
        try {
            dispatch(event);
        } catch (RuntimeException e) {
            failedCounter.increment();
            log.error("Failed to apply {} webhook {} ({}): {}",
                    event.getProvider(), event.getEventId(), event.getEventType(), e.getMessage(), e);
            eventStore.markFailed(event.getProvider(), event.getEventId(), describe(e));
            return WebhookProcessingStatus.FAILED;
        }

        eventStore.markProcessed(event.getProvider(), event.getEventId());
        processedCounter.increment();
        return WebhookProcessingStatus.COMPLETED;
    }

    void dispatch(NormalizedEvent event) {
        CanonicalStatus status = event.getCanonicalStatus();
        EventCategory category = event.getCategory() == null ? EventCategory.OTHER : event.getCategory();

        if (status == null) {
            log.info("Event {} ({}) carries no outcome, acknowledged without action",
                    event.getEventId(), event.getEventType());
            return;
        }

        switch (status) {
            case COMPLETED -> {
                switch (category) {
                    case PAYMENT -> handlePaymentCompleted(event);
                    case SUBSCRIPTION -> handleSubscriptionActive(event);
                    case CUSTOMER_SETUP -> handleCustomerSetup(event);
                    default -> log.info("No handler for completed {} event {}", category, event.getEventId());
                }
            }
            case CANCELED -> {
                if (category == EventCategory.SUBSCRIPTION) {
                    handleSubscriptionCanceled(event);
                } else {
                    log.info("Payment {} canceled ({}), no ledger effect",
                            event.getProviderPaymentRef(), event.getEventId());
                }
            }
            case REFUNDED -> log.info("Payment {} refunded ({}), no ledger effect",
                    event.getProviderPaymentRef(), event.getEventId());
            case FAILED -> log.warn("{} {} failed at provider ({}), no ledger effect",
                    category, firstNonBlank(event.getProviderPaymentRef(), event.getProviderSubscriptionId()),
                    event.getEventId());
        }
    }

    private void handlePaymentCompleted(NormalizedEvent event) {
        Optional<UUID> subject = subjectResolver.resolve(event);
        if (subject.isEmpty()) {
            unresolvedSubjectCounter.increment();
            log.warn("No subject for {} payment {} (event {}, customer {}), skipping credit allocation",
                    event.getProvider(), event.getProviderPaymentRef(), event.getEventId(),
                    event.getProviderCustomerId());
            return;
        }
        if (!StringUtils.hasText(event.getProviderPaymentRef())) {
            throw new ValidationException("Payment event " + event.getEventId() + " has no payment reference");
        }

        UUID subjectId = subject.get();
        String serviceProvider = serviceProvider(event);
        BigDecimal credits = planCatalogService.resolveCredits(event);

        if (StringUtils.hasText(event.getProviderCustomerId())) {
            customerMappingService.ensureMapping(event.getProvider(), event.getProviderCustomerId(),
                    subjectId, event.getCustomerEmail());
        }
        if (StringUtils.hasText(event.getProviderSubscriptionId())) {
            Subscription subscription = subscriptionService.upsert(event, subjectId, serviceProvider);
            if (subscription.isCanceled()) {
                canceledSubscriptionCounter.increment();
                log.warn("Payment {} (event {}) funds subscription {} canceled at {}, skipping credit allocation",
                        event.getProviderPaymentRef(), event.getEventId(),
                        subscription.getProviderSubscriptionId(), subscription.getCanceledAt());
                return;
            }
        }

        String referenceId = event.getProvider() + ":" + event.getProviderPaymentRef();
        LedgerResult result = ledgerService.allocateCredits(subjectId, serviceProvider, credits,
                allocationDescription(event), referenceId);

        if (result.isReplayed()) {
            log.info("Payment {} was already credited, balance {}", referenceId,
                    result.getBalance().getCurrentBalance());
        }
    }

    private void handleSubscriptionActive(NormalizedEvent event) {
        Optional<UUID> subject = subjectResolver.resolve(event);
        if (subject.isEmpty()) {
            log.warn("No subject for {} subscription {} (event {}), skipping",
                    event.getProvider(), event.getProviderSubscriptionId(), event.getEventId());
            return;
        }
        if (StringUtils.hasText(event.getProviderCustomerId())) {
            customerMappingService.ensureMapping(event.getProvider(), event.getProviderCustomerId(),
                    subject.get(), event.getCustomerEmail());
        }
        subscriptionService.upsert(event, subject.get(), serviceProvider(event));
    }

    private void handleSubscriptionCanceled(NormalizedEvent event) {
        if (!StringUtils.hasText(event.getProviderSubscriptionId())) {
            throw new ValidationException("Cancellation event " + event.getEventId() + " has no subscription id");
        }
        CancellationResult result = subscriptionReconciler.cancel(event.getProviderSubscriptionId());
        if (result.isBalanceReset()) {
            log.info("Subscription {} canceled, deducted {} credits from subject {}",
                    result.getProviderSubscriptionId(), result.getDeducted(), result.getSubjectId());
        } else {
            log.info("Subscription {} canceled, balance already zero", result.getProviderSubscriptionId());
        }
    }

    private void handleCustomerSetup(NormalizedEvent event) {
        if (!StringUtils.hasText(event.getProviderCustomerId())) {
            log.warn("Setup event {} has no customer id, nothing to map", event.getEventId());
            return;
        }
        Optional<UUID> subject = subjectResolver.resolve(event);
        if (subject.isEmpty()) {
            log.warn("No subject for {} customer {} (event {}), mapping not created",
                    event.getProvider(), event.getProviderCustomerId(), event.getEventId());
            return;
        }
        customerMappingService.ensureMapping(event.getProvider(), event.getProviderCustomerId(),
                subject.get(), event.getCustomerEmail());
    }

    private String serviceProvider(NormalizedEvent event) {
        return StringUtils.hasText(event.getServiceProvider()) ? event.getServiceProvider() : defaultServiceProvider;
    }

    private static String allocationDescription(NormalizedEvent event) {
        String plan = firstNonBlank(event.getProductName(), event.getPriceId(), event.getProductId());
        String ref = event.getProvider() + " " + event.getProviderPaymentRef();
        return plan == null ? "Credits for payment " + ref : "Credits for " + plan + " (" + ref + ")";
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName()
                : e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }

    private WebhookAck ack(NormalizedEvent event, WebhookProcessingStatus status, boolean duplicate, String message) {
        return WebhookAck.builder()
                .accepted(true)
                .duplicate(duplicate)
                .provider(event.getProvider())
                .eventId(event.getEventId())
                .eventType(event.getEventType())
                .status(status)
                .message(message)
                .build();
    }
}

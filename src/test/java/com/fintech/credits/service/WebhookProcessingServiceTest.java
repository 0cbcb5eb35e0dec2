package com.fintech.credits.service;

import com.fintech.credits.dto.CancellationResult;
import com.fintech.credits.dto.LedgerResult;
import com.fintech.credits.dto.NormalizedEvent;
import com.fintech.credits.dto.WebhookAck;
import com.fintech.credits.entity.CanonicalStatus;
import com.fintech.credits.entity.EventCategory;
import com.fintech.credits.entity.Subscription;
import com.fintech.credits.entity.SubscriptionStatus;
import com.fintech.credits.entity.UserCreditBalance;
import com.fintech.credits.entity.WebhookEvent;
import com.fintech.credits.entity.WebhookProcessingStatus;
import com.fintech.credits.exception.NotFoundException;
import com.fintech.credits.exception.ProviderVerificationException;
import com.fintech.credits.service.provider.PaymentProviderAdapter;
import com.fintech.credits.service.provider.ProviderAdapterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for WebhookProcessingService.
 * <p>
 * Tests cover:
 * - Rejection of unverifiable deliveries before anything is stored
 * - Duplicate redeliveries and deliveries racing the retry sweeper
 * - Dispatch by canonical status and category, including payments for canceled subscriptions
 * - Handler failures recorded on the stored event
 */
@ExtendWith(MockitoExtension.class)
class WebhookProcessingServiceTest {

    private static final UUID SUBJECT = UUID.fromString("6f1c2a7e-3b4d-4e5f-8a9b-0c1d2e3f4a5b");
    private static final byte[] PAYLOAD = "{}".getBytes(StandardCharsets.UTF_8);

    @Mock
    private ProviderAdapterRegistry adapterRegistry;

    @Mock
    private PaymentProviderAdapter adapter;

    @Mock
    private WebhookEventStore eventStore;

    @Mock
    private CreditLedgerService ledgerService;

    @Mock
    private SubscriptionReconciler subscriptionReconciler;

    @Mock
    private SubscriptionService subscriptionService;

    @Mock
    private CustomerMappingService customerMappingService;

    @Mock
    private PlanCatalogService planCatalogService;

    @Mock
    private SubjectResolver subjectResolver;

    private WebhookProcessingService processingService;

    @BeforeEach
    void setUp() {
        processingService = new WebhookProcessingService(
                adapterRegistry,
                eventStore,
                ledgerService,
                subscriptionReconciler,
                subscriptionService,
                customerMappingService,
                planCatalogService,
                subjectResolver,
                new SimpleMeterRegistry(),
                "semo"
        );
        processingService.initMetrics();
    }

    @Nested
    @DisplayName("Receive Tests")
    class ReceiveTests {

        @Test
        @DisplayName("Should reject an unverifiable delivery without storing it")
        void shouldRejectUnverifiedDelivery() {
            when(adapterRegistry.get("stripe")).thenReturn(adapter);
            when(adapter.normalize(PAYLOAD, "bad"))
                    .thenThrow(new ProviderVerificationException("Stripe signature mismatch", "stripe"));

            assertThatThrownBy(() -> processingService.receive("stripe", PAYLOAD, "bad"))
                    .isInstanceOf(ProviderVerificationException.class);

            verifyNoInteractions(eventStore, ledgerService);
        }

        @Test
        @DisplayName("Should store, apply and acknowledge a new completed payment")
        void shouldProcessNewPayment() {
            // Given
            NormalizedEvent event = paymentEvent();
            givenVerified(event);
            when(eventStore.saveEvent(eq("stripe"), eq("evt_1"), eq("invoice.paid"),
                    eq(CanonicalStatus.COMPLETED), anyString())).thenReturn(true);
            WebhookEvent stored = storedEvent(WebhookProcessingStatus.PENDING);
            when(eventStore.getEvent("stripe", "evt_1")).thenReturn(Optional.of(stored));
            when(eventStore.claim(stored)).thenReturn(true);
            givenResolvablePayment(event);

            // When
            WebhookAck ack = processingService.receive("stripe", PAYLOAD, "sig");

            // Then
            assertThat(ack.isAccepted()).isTrue();
            assertThat(ack.isDuplicate()).isFalse();
            verify(eventStore).claim(stored);
            assertThat(ack.getStatus()).isEqualTo(WebhookProcessingStatus.COMPLETED);
            verify(ledgerService).allocateCredits(eq(SUBJECT), eq("semo"), eq(new BigDecimal("100")),
                    anyString(), eq("stripe:in_1"));
            verify(customerMappingService).ensureMapping("stripe", "cus_1", SUBJECT, "a@example.com");
            verify(subscriptionService).upsert(event, SUBJECT, "semo");
            verify(eventStore).markProcessed("stripe", "evt_1");
        }

        @Test
        @DisplayName("Should acknowledge a redelivery of a completed event without side effects")
        void shouldAcknowledgeDuplicate() {
            // Given
            NormalizedEvent event = paymentEvent();
            givenVerified(event);
            when(eventStore.saveEvent(anyString(), anyString(), anyString(), any(), anyString())).thenReturn(false);
            when(eventStore.getEvent("stripe", "evt_1"))
                    .thenReturn(Optional.of(storedEvent(WebhookProcessingStatus.COMPLETED)));

            // When
            WebhookAck ack = processingService.receive("stripe", PAYLOAD, "sig");

            // Then
            assertThat(ack.isDuplicate()).isTrue();
            assertThat(ack.getStatus()).isEqualTo(WebhookProcessingStatus.COMPLETED);
            verifyNoInteractions(ledgerService, subjectResolver);
            verify(eventStore, never()).claim(any());
            verify(eventStore, never()).markProcessed(anyString(), anyString());
        }

        @Test
        @DisplayName("Should acknowledge without applying when the retry sweeper holds the event")
        void shouldYieldToSweeperClaim() {
            // Given: a failed event the sweeper claims between our read and our claim
            NormalizedEvent event = paymentEvent();
            givenVerified(event);
            WebhookEvent failed = storedEvent(WebhookProcessingStatus.FAILED);
            when(eventStore.saveEvent(anyString(), anyString(), anyString(), any(), anyString())).thenReturn(false);
            when(eventStore.getEvent("stripe", "evt_1")).thenReturn(Optional.of(failed));
            when(eventStore.claim(failed)).thenReturn(false);

            // When
            WebhookAck ack = processingService.receive("stripe", PAYLOAD, "sig");

            // Then
            assertThat(ack.isAccepted()).isTrue();
            assertThat(ack.isDuplicate()).isTrue();
            assertThat(ack.getStatus()).isEqualTo(WebhookProcessingStatus.PROCESSING);
            verifyNoInteractions(ledgerService, subjectResolver);
            verify(eventStore, never()).markFailed(anyString(), anyString(), anyString());
            verify(eventStore, never()).markProcessed(anyString(), anyString());
        }

        @Test
        @DisplayName("Should process a redelivery of a failed event again")
        void shouldReprocessFailedRedelivery() {
            NormalizedEvent event = paymentEvent();
            givenVerified(event);
            when(eventStore.saveEvent(anyString(), anyString(), anyString(), any(), anyString())).thenReturn(false);
            when(eventStore.getEvent("stripe", "evt_1"))
                    .thenReturn(Optional.of(storedEvent(WebhookProcessingStatus.FAILED)));
            when(eventStore.claim(any(WebhookEvent.class))).thenReturn(true);
            givenResolvablePayment(event);

            WebhookAck ack = processingService.receive("stripe", PAYLOAD, "sig");

            assertThat(ack.isDuplicate()).isFalse();
            assertThat(ack.getStatus()).isEqualTo(WebhookProcessingStatus.COMPLETED);
            verify(ledgerService).allocateCredits(any(), anyString(), any(), anyString(), eq("stripe:in_1"));
        }

        @Test
        @DisplayName("Should acknowledge and record a handler failure for retry")
        void shouldRecordHandlerFailure() {
            // Given
            NormalizedEvent event = paymentEvent();
            givenVerified(event);
            when(eventStore.saveEvent(anyString(), anyString(), anyString(), any(), anyString())).thenReturn(true);
            when(eventStore.getEvent("stripe", "evt_1"))
                    .thenReturn(Optional.of(storedEvent(WebhookProcessingStatus.PENDING)));
            when(eventStore.claim(any(WebhookEvent.class))).thenReturn(true);
            when(subjectResolver.resolve(event)).thenReturn(Optional.of(SUBJECT));
            when(planCatalogService.resolveCredits(event))
                    .thenThrow(new NotFoundException("Payment plan", "price=price_pro, product=null"));

            // When
            WebhookAck ack = processingService.receive("stripe", PAYLOAD, "sig");

            // Then
            assertThat(ack.isAccepted()).isTrue();
            assertThat(ack.getStatus()).isEqualTo(WebhookProcessingStatus.FAILED);
            verify(eventStore).markFailed(eq("stripe"), eq("evt_1"), contains("Payment plan not found"));
            verify(eventStore, never()).markProcessed(anyString(), anyString());
            verifyNoInteractions(ledgerService);
        }
    }

    @Nested
    @DisplayName("Dispatch Tests")
    class DispatchTests {

        @Test
        @DisplayName("Should skip allocation when the subject cannot be resolved")
        void shouldSkipUnresolvedSubject() {
            NormalizedEvent event = paymentEvent();
            when(subjectResolver.resolve(event)).thenReturn(Optional.empty());

            assertThat(processingService.apply(event)).isEqualTo(WebhookProcessingStatus.COMPLETED);

            verifyNoInteractions(ledgerService, planCatalogService);
            verify(eventStore).markProcessed("stripe", "evt_1");
        }

        @Test
        @DisplayName("Should credit the service provider named in the payment metadata")
        void shouldHonourServiceProviderOverride() {
            NormalizedEvent event = paymentEvent();
            event.setServiceProvider("acme");
            event.setProviderSubscriptionId(null);
            event.setProviderCustomerId(null);
            when(subjectResolver.resolve(event)).thenReturn(Optional.of(SUBJECT));
            when(planCatalogService.resolveCredits(event)).thenReturn(new BigDecimal("100"));
            when(ledgerService.allocateCredits(any(), anyString(), any(), anyString(), anyString()))
                    .thenReturn(ledgerResult(false));

            processingService.dispatch(event);

            verify(ledgerService).allocateCredits(eq(SUBJECT), eq("acme"), any(), anyString(), eq("stripe:in_1"));
            verifyNoInteractions(subscriptionService, customerMappingService);
        }

        @Test
        @DisplayName("Should not credit a payment whose subscription is already canceled")
        void shouldSkipPaymentForCanceledSubscription() {
            // Given: a retried invoice processed after the subscription was deleted
            NormalizedEvent event = paymentEvent();
            when(subjectResolver.resolve(event)).thenReturn(Optional.of(SUBJECT));
            when(planCatalogService.resolveCredits(event)).thenReturn(new BigDecimal("100"));
            when(subscriptionService.upsert(event, SUBJECT, "semo"))
                    .thenReturn(subscription(SubscriptionStatus.INACTIVE, LocalDateTime.of(2026, 1, 15, 9, 0)));

            // When
            WebhookProcessingStatus outcome = processingService.apply(event);

            // Then
            assertThat(outcome).isEqualTo(WebhookProcessingStatus.COMPLETED);
            verifyNoInteractions(ledgerService);
            verify(eventStore).markProcessed("stripe", "evt_1");
        }

        @Test
        @DisplayName("Should hand subscription cancellations to the reconciler")
        void shouldCancelSubscription() {
            NormalizedEvent event = NormalizedEvent.builder()
                    .provider("stripe")
                    .eventId("evt_del")
                    .eventType("customer.subscription.deleted")
                    .category(EventCategory.SUBSCRIPTION)
                    .canonicalStatus(CanonicalStatus.CANCELED)
                    .providerSubscriptionId("sub_1")
                    .build();
            when(subscriptionReconciler.cancel("sub_1")).thenReturn(CancellationResult.builder()
                    .providerSubscriptionId("sub_1")
                    .subjectId(SUBJECT)
                    .provider("semo")
                    .build());

            assertThat(processingService.apply(event)).isEqualTo(WebhookProcessingStatus.COMPLETED);

            verify(subscriptionReconciler).cancel("sub_1");
            verifyNoInteractions(ledgerService);
        }

        @Test
        @DisplayName("Should fail a cancellation that names no subscription")
        void shouldFailCancellationWithoutSubscription() {
            NormalizedEvent event = NormalizedEvent.builder()
                    .provider("stripe")
                    .eventId("evt_del")
                    .eventType("customer.subscription.deleted")
                    .category(EventCategory.SUBSCRIPTION)
                    .canonicalStatus(CanonicalStatus.CANCELED)
                    .build();

            assertThat(processingService.apply(event)).isEqualTo(WebhookProcessingStatus.FAILED);
            verify(eventStore).markFailed(eq("stripe"), eq("evt_del"), contains("ValidationException"));
        }

        @Test
        @DisplayName("Should record the customer mapping for a completed setup")
        void shouldMapCustomerOnSetup() {
            NormalizedEvent event = NormalizedEvent.builder()
                    .provider("stripe")
                    .eventId("evt_seti")
                    .eventType("setup_intent.succeeded")
                    .category(EventCategory.CUSTOMER_SETUP)
                    .canonicalStatus(CanonicalStatus.COMPLETED)
                    .providerCustomerId("cus_9")
                    .customerEmail("b@example.com")
                    .build();
            when(subjectResolver.resolve(event)).thenReturn(Optional.of(SUBJECT));

            processingService.dispatch(event);

            verify(customerMappingService).ensureMapping("stripe", "cus_9", SUBJECT, "b@example.com");
        }

        @Test
        @DisplayName("Should leave the ledger alone for refunds, failures and events without an outcome")
        void shouldIgnoreNonCreditingOutcomes() {
            NormalizedEvent refund = paymentEvent();
            refund.setCanonicalStatus(CanonicalStatus.REFUNDED);
            NormalizedEvent failed = paymentEvent();
            failed.setCanonicalStatus(CanonicalStatus.FAILED);
            NormalizedEvent other = paymentEvent();
            other.setCanonicalStatus(null);
            other.setCategory(null);

            processingService.dispatch(refund);
            processingService.dispatch(failed);
            processingService.dispatch(other);

            verifyNoInteractions(ledgerService, subscriptionReconciler, subjectResolver);
        }
    }

    // Helper methods

    private void givenVerified(NormalizedEvent event) {
        when(adapterRegistry.get("stripe")).thenReturn(adapter);
        when(adapter.normalize(PAYLOAD, "sig")).thenReturn(event);
    }

    private void givenResolvablePayment(NormalizedEvent event) {
        when(subjectResolver.resolve(event)).thenReturn(Optional.of(SUBJECT));
        when(planCatalogService.resolveCredits(event)).thenReturn(new BigDecimal("100"));
        when(subscriptionService.upsert(event, SUBJECT, "semo"))
                .thenReturn(subscription(SubscriptionStatus.ACTIVE, null));
        when(ledgerService.allocateCredits(any(), anyString(), any(), anyString(), anyString()))
                .thenReturn(ledgerResult(false));
    }

    private Subscription subscription(SubscriptionStatus status, LocalDateTime canceledAt) {
        return Subscription.builder()
                .id(5L)
                .providerSubscriptionId("sub_1")
                .provider("stripe")
                .subjectId(SUBJECT)
                .serviceProvider("semo")
                .status(status)
                .canceledAt(canceledAt)
                .build();
    }

    private NormalizedEvent paymentEvent() {
        return NormalizedEvent.builder()
                .provider("stripe")
                .eventId("evt_1")
                .eventType("invoice.paid")
                .category(EventCategory.PAYMENT)
                .canonicalStatus(CanonicalStatus.COMPLETED)
                .providerPaymentRef("in_1")
                .providerCustomerId("cus_1")
                .providerSubscriptionId("sub_1")
                .customerEmail("a@example.com")
                .priceId("price_pro")
                .productName("Pro")
                .build();
    }

    private WebhookEvent storedEvent(WebhookProcessingStatus status) {
        return WebhookEvent.builder()
                .id(1L)
                .provider("stripe")
                .eventId("evt_1")
                .eventType("invoice.paid")
                .status(status)
                .payload("{}")
                .build();
    }

    private LedgerResult ledgerResult(boolean replayed) {
        return LedgerResult.builder()
                .balance(UserCreditBalance.builder()
                        .subjectId(SUBJECT)
                        .provider("semo")
                        .currentBalance(new BigDecimal("100.00"))
                        .build())
                .replayed(replayed)
                .build();
    }
}

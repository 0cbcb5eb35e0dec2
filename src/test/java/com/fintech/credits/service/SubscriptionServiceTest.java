package com.fintech.credits.service;

import com.fintech.credits.dto.NormalizedEvent;
import com.fintech.credits.entity.CanonicalStatus;
import com.fintech.credits.entity.EventCategory;
import com.fintech.credits.entity.Subscription;
import com.fintech.credits.entity.SubscriptionStatus;
import com.fintech.credits.exception.ValidationException;
import com.fintech.credits.repository.SubscriptionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubscriptionServiceTest {

    private static final UUID SUBJECT = UUID.fromString("6f1c2a7e-3b4d-4e5f-8a9b-0c1d2e3f4a5b");
    private static final LocalDateTime CANCELED_AT = LocalDateTime.of(2026, 1, 15, 9, 0);

    @Mock
    private SubscriptionRepository repository;

    private SubscriptionService subscriptionService;

    @BeforeEach
    void setUp() {
        subscriptionService = new SubscriptionService(repository);
    }

    @Test
    @DisplayName("Should create an ACTIVE subscription for the service provider tag")
    void shouldCreateSubscription() {
        when(repository.findByProviderSubscriptionId("sub_1")).thenReturn(Optional.empty());
        when(repository.saveAndFlush(any(Subscription.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Subscription created = subscriptionService.upsert(paidInvoice(), SUBJECT, "semo");

        assertThat(created.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        assertThat(created.getServiceProvider()).isEqualTo("semo");
        assertThat(created.getPlanId()).isEqualTo("price_pro");
        assertThat(created.isCanceled()).isFalse();
    }

    @Test
    @DisplayName("Should keep a canceled subscription canceled when a late payment arrives")
    void shouldNotReactivateCanceledSubscription() {
        // Given
        Subscription canceled = Subscription.builder()
                .id(3L)
                .providerSubscriptionId("sub_1")
                .provider("stripe")
                .subjectId(SUBJECT)
                .serviceProvider("semo")
                .status(SubscriptionStatus.INACTIVE)
                .canceledAt(CANCELED_AT)
                .planId("price_basic")
                .build();
        when(repository.findByProviderSubscriptionId("sub_1")).thenReturn(Optional.of(canceled));
        when(repository.save(any(Subscription.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        Subscription updated = subscriptionService.upsert(paidInvoice(), SUBJECT, "semo");

        // Then
        assertThat(updated.getStatus()).isEqualTo(SubscriptionStatus.INACTIVE);
        assertThat(updated.getCanceledAt()).isEqualTo(CANCELED_AT);
        assertThat(updated.isCanceled()).isTrue();
        assertThat(updated.getPlanId()).isEqualTo("price_pro");
    }

    @Test
    @DisplayName("Should reject an event without a subscription id")
    void shouldRequireSubscriptionId() {
        NormalizedEvent event = paidInvoice();
        event.setProviderSubscriptionId(" ");

        assertThatThrownBy(() -> subscriptionService.upsert(event, SUBJECT, "semo"))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(repository);
    }

    private NormalizedEvent paidInvoice() {
        return NormalizedEvent.builder()
                .provider("stripe")
                .eventId("evt_late")
                .eventType("invoice.paid")
                .category(EventCategory.PAYMENT)
                .canonicalStatus(CanonicalStatus.COMPLETED)
                .providerSubscriptionId("sub_1")
                .providerCustomerId("cus_1")
                .priceId("price_pro")
                .build();
    }
}

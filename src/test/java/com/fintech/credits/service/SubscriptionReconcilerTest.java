package com.fintech.credits.service;

import com.fintech.credits.dto.CancellationResult;
import com.fintech.credits.entity.CreditTransaction;
import com.fintech.credits.entity.CreditTransactionType;
import com.fintech.credits.entity.Subscription;
import com.fintech.credits.entity.SubscriptionStatus;
import com.fintech.credits.exception.NotFoundException;
import com.fintech.credits.exception.ValidationException;
import com.fintech.credits.repository.SubscriptionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SubscriptionReconciler.
 */
@ExtendWith(MockitoExtension.class)
class SubscriptionReconcilerTest {

    private static final UUID SUBJECT = UUID.fromString("0b7e8a52-93f1-4c3e-9f44-5a0c6d1e2f33");
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 15, 10, 0);

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private CreditLedgerService ledgerService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private SubscriptionReconciler reconciler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
        reconciler = new SubscriptionReconciler(subscriptionRepository, ledgerService, transactionManager, clock, 10);
    }

    @Test
    @DisplayName("Should deactivate the subscription and drain the service provider balance")
    void shouldCancelAndDrain() {
        // Given
        Subscription subscription = subscription(SubscriptionStatus.ACTIVE, null);
        CreditTransaction deduction = CreditTransaction.builder()
                .subjectId(SUBJECT)
                .provider("semo")
                .type(CreditTransactionType.SUBSCRIPTION_CANCELLATION)
                .amount(new BigDecimal("-70.00"))
                .balanceAfter(new BigDecimal("0.00"))
                .build();
        when(subscriptionRepository.findByProviderSubscriptionIdForUpdate("sub_1"))
                .thenReturn(Optional.of(subscription));
        when(ledgerService.drainBalance(eq(SUBJECT), eq("semo"), anyString(), eq(11L)))
                .thenReturn(Optional.of(deduction));

        // When
        CancellationResult result = reconciler.cancel("sub_1");

        // Then
        assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.INACTIVE);
        assertThat(subscription.getCanceledAt()).isEqualTo(NOW);
        verify(subscriptionRepository).save(subscription);
        verify(transactionManager).commit(any());

        assertThat(result.isBalanceReset()).isTrue();
        assertThat(result.getDeducted()).isEqualByComparingTo("70");
        assertThat(result.getProvider()).isEqualTo("semo");
        assertThat(result.getSubjectId()).isEqualTo(SUBJECT);
    }

    @Test
    @DisplayName("Should keep the first cancellation time and deduct nothing on repeat")
    void shouldBeNoOpWhenAlreadyCanceled() {
        // Given
        LocalDateTime firstCanceledAt = NOW.minusDays(2);
        Subscription subscription = subscription(SubscriptionStatus.INACTIVE, firstCanceledAt);
        when(subscriptionRepository.findByProviderSubscriptionIdForUpdate("sub_1"))
                .thenReturn(Optional.of(subscription));
        when(ledgerService.drainBalance(eq(SUBJECT), eq("semo"), anyString(), eq(11L)))
                .thenReturn(Optional.empty());

        // When
        CancellationResult result = reconciler.cancel("sub_1");

        // Then
        assertThat(result.isBalanceReset()).isFalse();
        assertThat(result.getDeducted()).isEqualByComparingTo("0");
        assertThat(subscription.getCanceledAt()).isEqualTo(firstCanceledAt);
    }

    @Test
    @DisplayName("Should fail with NotFound for an unknown subscription and touch no balance")
    void shouldRejectUnknownSubscription() {
        when(subscriptionRepository.findByProviderSubscriptionIdForUpdate("sub_missing"))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> reconciler.cancel("sub_missing"))
                .isInstanceOf(NotFoundException.class);

        verifyNoInteractions(ledgerService);
        verify(transactionManager).rollback(any());
    }

    @Test
    @DisplayName("Should require a subscription id")
    void shouldRequireSubscriptionId() {
        assertThatThrownBy(() -> reconciler.cancel(" "))
                .isInstanceOf(ValidationException.class);

        verifyNoInteractions(subscriptionRepository, ledgerService, transactionManager);
    }

    private Subscription subscription(SubscriptionStatus status, LocalDateTime canceledAt) {
        return Subscription.builder()
                .id(11L)
                .providerSubscriptionId("sub_1")
                .provider("stripe")
                .subjectId(SUBJECT)
                .serviceProvider("semo")
                .status(status)
                .canceledAt(canceledAt)
                .build();
    }
}

package com.fintech.credits.service;

import com.fintech.credits.dto.CancellationResult;
import com.fintech.credits.entity.CreditTransaction;
import com.fintech.credits.entity.Subscription;
import com.fintech.credits.entity.SubscriptionStatus;
import com.fintech.credits.exception.NotFoundException;
import com.fintech.credits.exception.ValidationException;
import com.fintech.credits.repository.SubscriptionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Zeroes a subject's balance when the subscription funding it is canceled.
 * <p>
 * Credits are subscription scoped: after cancellation the balance is exactly zero no matter
 * how many times the cancellation is observed. The status change, the balance read and the
 * deduction commit in one transaction.
 */
@Service
@Slf4j
public class SubscriptionReconciler {

    private final SubscriptionRepository subscriptionRepository;
    private final CreditLedgerService ledgerService;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public SubscriptionReconciler(SubscriptionRepository subscriptionRepository,
                                  CreditLedgerService ledgerService,
                                  PlatformTransactionManager transactionManager,
                                  Clock clock,
                                  @Value("${ledger.transaction-timeout-seconds:10}") int transactionTimeoutSeconds) {
        this.subscriptionRepository = subscriptionRepository;
        this.ledgerService = ledgerService;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(transactionTimeoutSeconds);
    }

    /**
     * Deactivate the subscription and drain its balance.
     * <p>
     * A positive balance is offset by a SUBSCRIPTION_CANCELLATION entry of {@code -balance};
     * a zero or missing balance is left alone, so repeated calls are no-ops.
     *
     * @throws NotFoundException if the subscription is unknown
     */
    public CancellationResult cancel(String providerSubscriptionId) {
        if (!StringUtils.hasText(providerSubscriptionId)) {
            throw new ValidationException("Provider subscription id is required");
        }

        return transactionTemplate.execute(status -> {
            Subscription subscription = subscriptionRepository
                    .findByProviderSubscriptionIdForUpdate(providerSubscriptionId)
                    .orElseThrow(() -> new NotFoundException("Subscription", providerSubscriptionId));

            if (subscription.getStatus() != SubscriptionStatus.INACTIVE) {
                log.info("Deactivating subscription {} of subject {}",
                        providerSubscriptionId, subscription.getSubjectId());
            }
            subscription.setStatus(SubscriptionStatus.INACTIVE);
            if (subscription.getCanceledAt() == null) {
                subscription.setCanceledAt(LocalDateTime.now(clock));
            }
            subscriptionRepository.save(subscription);

            Optional<CreditTransaction> deduction = ledgerService.drainBalance(
                    subscription.getSubjectId(),
                    subscription.getServiceProvider(),
                    "Subscription " + providerSubscriptionId + " canceled",
                    subscription.getId());

            return CancellationResult.builder()
                    .providerSubscriptionId(providerSubscriptionId)
                    .subjectId(subscription.getSubjectId())
                    .provider(subscription.getServiceProvider())
                    .deducted(deduction.map(tx -> tx.getAmount().negate()).orElse(BigDecimal.ZERO))
                    .transaction(deduction.orElse(null))
                    .build();
        });
    }
}

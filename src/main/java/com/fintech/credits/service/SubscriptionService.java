package com.fintech.credits.service;

import com.fintech.credits.dto.NormalizedEvent;
import com.fintech.credits.entity.CanonicalStatus;
import com.fintech.credits.entity.Subscription;
import com.fintech.credits.entity.SubscriptionStatus;
import com.fintech.credits.exception.ValidationException;
import com.fintech.credits.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.UUID;

/**
 * Keeps subscription rows in step with provider subscription and invoice events.
 * Cancellation with its balance reset lives in {@link SubscriptionReconciler}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    private final SubscriptionRepository repository;

    public Optional<Subscription> getByProviderSubscriptionId(String providerSubscriptionId) {
        return repository.findByProviderSubscriptionId(providerSubscriptionId);
    }

    /**
     * Create or update the subscription named by the event.
     * <p>
     * A COMPLETED outcome (active, trialing, paid invoice) marks it ACTIVE; other outcomes only
     * refresh plan and period. Deactivation goes through {@link SubscriptionReconciler#cancel}.
     * A canceled subscription stays canceled: late or retried events only refresh its details.
     *
     * @param serviceProvider ledger provider tag whose balance this subscription funds
     */
    public Subscription upsert(NormalizedEvent event, UUID subjectId, String serviceProvider) {
        if (!StringUtils.hasText(event.getProviderSubscriptionId()) || subjectId == null) {
            throw new ValidationException("Subscription events need a subscription id and a subject");
        }

        Optional<Subscription> existing = repository.findByProviderSubscriptionId(event.getProviderSubscriptionId());
        if (existing.isPresent()) {
            return update(existing.get(), event, subjectId);
        }

        Subscription subscription = Subscription.builder()
                .providerSubscriptionId(event.getProviderSubscriptionId())
                .provider(event.getProvider())
                .subjectId(subjectId)
                .providerCustomerId(event.getProviderCustomerId())
                .serviceProvider(serviceProvider)
                .status(SubscriptionStatus.ACTIVE)
                .planId(event.getPriceId())
                .currentPeriodEnd(event.getCurrentPeriodEnd())
                .build();
        try {
            Subscription saved = repository.saveAndFlush(subscription);
            log.info("Created subscription {} for subject {} on {}",
                    saved.getProviderSubscriptionId(), subjectId, serviceProvider);
            return saved;
        } catch (DataIntegrityViolationException e) {
            Subscription concurrent = repository.findByProviderSubscriptionId(event.getProviderSubscriptionId())
                    .orElseThrow(() -> e);
            return update(concurrent, event, subjectId);
        }
    }

    private Subscription update(Subscription subscription, NormalizedEvent event, UUID subjectId) {
        if (!subscription.getSubjectId().equals(subjectId)) {
            log.warn("Subscription {} belongs to subject {}, event {} names {}; keeping owner",
                    subscription.getProviderSubscriptionId(), subscription.getSubjectId(),
                    event.getEventId(), subjectId);
        }
        if (subscription.isCanceled()) {
            log.info("Subscription {} was canceled at {}, event {} does not reactivate it",
                    subscription.getProviderSubscriptionId(), subscription.getCanceledAt(), event.getEventId());
        } else if (event.getCanonicalStatus() == CanonicalStatus.COMPLETED
                && subscription.getStatus() != SubscriptionStatus.ACTIVE) {
            log.info("Reactivating subscription {}", subscription.getProviderSubscriptionId());
            subscription.setStatus(SubscriptionStatus.ACTIVE);
        }
        if (StringUtils.hasText(event.getPriceId())) {
            subscription.setPlanId(event.getPriceId());
        }
        if (event.getCurrentPeriodEnd() != null) {
            subscription.setCurrentPeriodEnd(event.getCurrentPeriodEnd());
        }
        if (subscription.getProviderCustomerId() == null) {
            subscription.setProviderCustomerId(event.getProviderCustomerId());
        }
        return repository.save(subscription);
    }
}

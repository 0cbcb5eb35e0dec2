package com.fintech.credits.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Provider subscription funding a subject's credits.
 * <p>
 * {@code serviceProvider} is the ledger provider tag whose balance is reset on cancellation.
 */
@Entity
@Table(name = "subscriptions", indexes = {
        @Index(name = "idx_subscription_subject", columnList = "subject_id"),
        @Index(name = "idx_subscription_customer", columnList = "provider_customer_id")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_provider_subscription", columnNames = "provider_subscription_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_subscription_id", nullable = false, length = 100)
    private String providerSubscriptionId;

    @Column(nullable = false, length = 20)
    private String provider;

    @Column(name = "subject_id", nullable = false)
    private UUID subjectId;

    @Column(name = "provider_customer_id", length = 100)
    private String providerCustomerId;

    @Column(name = "service_provider", nullable = false, length = 50)
    private String serviceProvider;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SubscriptionStatus status = SubscriptionStatus.ACTIVE;

    @Column(name = "plan_id", length = 100)
    private String planId;

    @Column(name = "current_period_end")
    private LocalDateTime currentPeriodEnd;

    @Column(name = "canceled_at")
    private LocalDateTime canceledAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Canceled at the provider. A canceled subscription is never reactivated and funds no
     * further credits; the provider issues a new subscription id for a resubscription.
     */
    public boolean isCanceled() {
        return status == SubscriptionStatus.INACTIVE && canceledAt != null;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}

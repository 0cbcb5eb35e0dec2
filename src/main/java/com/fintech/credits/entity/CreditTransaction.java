package com.fintech.credits.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Immutable ledger entry.
 * <p>
 * Entries are only ever inserted. {@code balanceAfter} equals the previous entry's
 * {@code balanceAfter} for the same (subject, provider) plus {@code amount}.
 * <p>
 * {@code referenceId} is the allocation idempotency key and {@code idempotencyKey} the
 * usage one; both are backed by unique constraints so that concurrent duplicates are
 * rejected by the database rather than by a read-then-insert check.
 */
@Entity
@Table(name = "credit_transactions", indexes = {
        @Index(name = "idx_credit_tx_subject_created", columnList = "subject_id, created_at"),
        @Index(name = "idx_credit_tx_subject_provider", columnList = "subject_id, provider")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_credit_tx_reference", columnNames = "reference_id"),
        @UniqueConstraint(name = "uk_credit_tx_idempotency_key", columnNames = "idempotency_key")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class CreditTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "subject_id", nullable = false, updatable = false)
    private UUID subjectId;

    @Column(nullable = false, updatable = false, length = 50)
    private String provider;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, updatable = false, length = 40)
    private CreditTransactionType type;

    @Column(nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "balance_after", nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal balanceAfter;

    @Column(nullable = false, updatable = false, length = 500)
    private String description;

    @Column(name = "feature_name", updatable = false, length = 100)
    private String featureName;

    @Column(name = "reference_id", updatable = false, length = 200)
    private String referenceId;

    @Column(name = "idempotency_key", updatable = false)
    private UUID idempotencyKey;

    @Column(name = "subscription_id", updatable = false)
    private Long subscriptionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}

package com.fintech.credits.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Cached running balance for one (subject, provider) pair.
 * <p>
 * Only written in the same database transaction as the {@link CreditTransaction}
 * insert that produced the new value, while holding a row lock on this row.
 */
@Entity
@Table(name = "user_credit_balances", uniqueConstraints = {
        @UniqueConstraint(name = "uk_balance_subject_provider", columnNames = {"subject_id", "provider"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserCreditBalance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "subject_id", nullable = false, updatable = false)
    private UUID subjectId;

    @Column(nullable = false, updatable = false, length = 50)
    private String provider;

    @Column(name = "current_balance", nullable = false, precision = 15, scale = 2)
    @Builder.Default
    private BigDecimal currentBalance = BigDecimal.ZERO;

    @Column(name = "last_transaction_at")
    private LocalDateTime lastTransactionAt;

    @Version
    private Long version;

    /**
     * Zero balance for a pair that has no row yet. Never persisted.
     */
    public static UserCreditBalance empty(UUID subjectId, String provider) {
        return UserCreditBalance.builder()
                .subjectId(subjectId)
                .provider(provider)
                .currentBalance(BigDecimal.ZERO)
                .build();
    }
}

package com.fintech.credits.dto;

import com.fintech.credits.entity.CreditTransaction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outcome of a subscription cancellation. {@code transaction} is null when there was
 * nothing to deduct (balance already zero or never created).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancellationResult {

    private String providerSubscriptionId;
    private UUID subjectId;
    private String provider;

    @Builder.Default
    private BigDecimal deducted = BigDecimal.ZERO;

    private CreditTransaction transaction;

    public boolean isBalanceReset() {
        return transaction != null;
    }
}

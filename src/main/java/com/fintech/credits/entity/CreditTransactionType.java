package com.fintech.credits.entity;

/**
 * Kind of ledger entry.
 */
public enum CreditTransactionType {
    /**
     * Credits granted for a payment or a system grant. Positive amount.
     */
    ALLOCATION,

    /**
     * Credits consumed by a feature. Negative amount.
     */
    USAGE,

    /**
     * Credits returned to the subject after a refunded usage.
     */
    REFUND,

    /**
     * Manual correction by an operator.
     */
    ADJUSTMENT,

    /**
     * Balance reset when the funding subscription ends. Negative amount, balance after is zero.
     */
    SUBSCRIPTION_CANCELLATION
}

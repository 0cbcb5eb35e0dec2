package com.fintech.credits.exception;

import java.math.BigDecimal;

/**
 * A usage request exceeds the available balance. Business rule, not a bug:
 * the ledger is left untouched.
 */
public class InsufficientBalanceException extends LedgerException {

    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientBalanceException(BigDecimal requested, BigDecimal available) {
        super(String.format("Insufficient balance: requested %s, available %s",
                requested.toPlainString(), available.toPlainString()));
        this.requested = requested;
        this.available = available;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public BigDecimal getShortfall() {
        return requested.subtract(available);
    }
}

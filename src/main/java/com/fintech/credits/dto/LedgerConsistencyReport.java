package com.fintech.credits.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Cached balance compared with the ledger it is derived from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerConsistencyReport {

    private UUID subjectId;
    private String provider;
    private BigDecimal cachedBalance;
    private BigDecimal ledgerSum;

    /**
     * {@code balanceAfter} of the most recent entry, or zero when there are none.
     */
    private BigDecimal lastBalanceAfter;

    private long transactionCount;
    private boolean consistent;
}

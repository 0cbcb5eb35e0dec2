package com.fintech.credits.dto;

import com.fintech.credits.entity.CreditTransaction;
import com.fintech.credits.entity.UserCreditBalance;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a ledger mutation.
 * <p>
 * {@code replayed} is set when the request matched an already recorded reference id or
 * idempotency key: {@code transaction} is then the original entry and nothing was written.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerResult {

    private UserCreditBalance balance;
    private CreditTransaction transaction;
    private boolean replayed;
}

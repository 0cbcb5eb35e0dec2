package com.fintech.credits.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * API view of a {@link LedgerResult}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerOperationResponse {

    private BalanceResponse balance;
    private TransactionResponse transaction;
    private boolean replayed;

    public static LedgerOperationResponse from(LedgerResult result) {
        return LedgerOperationResponse.builder()
                .balance(BalanceResponse.from(result.getBalance()))
                .transaction(TransactionResponse.from(result.getTransaction()))
                .replayed(result.isReplayed())
                .build();
    }
}

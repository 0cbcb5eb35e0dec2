package com.fintech.credits.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One offset/limit window of a subject's ledger history, most recent first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionHistoryPage {

    @Builder.Default
    private List<TransactionResponse> transactions = new ArrayList<>();

    private long total;
    private int limit;
    private long offset;
    private boolean hasMore;
}

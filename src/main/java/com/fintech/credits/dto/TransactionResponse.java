package com.fintech.credits.dto;

import com.fintech.credits.entity.CreditTransaction;
import com.fintech.credits.entity.CreditTransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionResponse {

    private Long id;
    private UUID subjectId;
    private String provider;
    private CreditTransactionType type;
    private BigDecimal amount;
    private BigDecimal balanceAfter;
    private String description;
    private String featureName;
    private String referenceId;
    private UUID idempotencyKey;
    private LocalDateTime createdAt;

    public static TransactionResponse from(CreditTransaction transaction) {
        return TransactionResponse.builder()
                .id(transaction.getId())
                .subjectId(transaction.getSubjectId())
                .provider(transaction.getProvider())
                .type(transaction.getType())
                .amount(transaction.getAmount())
                .balanceAfter(transaction.getBalanceAfter())
                .description(transaction.getDescription())
                .featureName(transaction.getFeatureName())
                .referenceId(transaction.getReferenceId())
                .idempotencyKey(transaction.getIdempotencyKey())
                .createdAt(transaction.getCreatedAt())
                .build();
    }
}

package com.fintech.credits.dto;

import com.fintech.credits.entity.UserCreditBalance;
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
public class BalanceResponse {

    private UUID subjectId;
    private String provider;
    private BigDecimal currentBalance;
    private LocalDateTime lastTransactionAt;

    public static BalanceResponse from(UserCreditBalance balance) {
        return BalanceResponse.builder()
                .subjectId(balance.getSubjectId())
                .provider(balance.getProvider())
                .currentBalance(balance.getCurrentBalance())
                .lastTransactionAt(balance.getLastTransactionAt())
                .build();
    }
}

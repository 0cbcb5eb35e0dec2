package com.fintech.credits.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanQuote {

    private String priceId;
    private String productId;
    private String displayName;
    private int creditsPerCycle;
    private boolean active;
}

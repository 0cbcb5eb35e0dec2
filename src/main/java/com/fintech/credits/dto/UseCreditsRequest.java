package com.fintech.credits.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UseCreditsRequest {

    @NotBlank
    @Size(max = 50)
    private String provider;

    @NotNull
    @Positive
    @Digits(integer = 13, fraction = 2)
    private BigDecimal amount;

    @NotBlank
    @Size(max = 500)
    private String description;

    @Size(max = 100)
    private String featureName;

    /**
     * Optional. A repeated key returns the originally recorded usage instead of debiting again.
     */
    private UUID idempotencyKey;
}

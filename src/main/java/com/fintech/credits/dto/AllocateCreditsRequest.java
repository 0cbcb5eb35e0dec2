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

/**
 * Manual (system driven) grant. {@code referenceId} makes the call safe to repeat.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllocateCreditsRequest {

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

    @Size(max = 200)
    private String referenceId;
}

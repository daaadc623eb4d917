package com.lendingledger.api.dto;

import com.lendingledger.common.Currency;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for withdrawing from the forfeited pool.
 */
@Data
public class WithdrawPoolRequest {

    @NotBlank(message = "Recipient account is required")
    private String toAccountId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    @Digits(integer = 17, fraction = 2, message = "Amount must be in whole cents")
    private BigDecimal amount;

    @NotNull(message = "Currency is required")
    private Currency currency;
}

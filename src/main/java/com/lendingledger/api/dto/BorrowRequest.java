package com.lendingledger.api.dto;

import com.lendingledger.common.Currency;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for borrowing a catalog item.
 */
@Data
public class BorrowRequest {

    @NotNull(message = "Item ID is required")
    @Positive(message = "Item ID must be positive")
    private Long itemId;

    @NotNull(message = "Deposit amount is required")
    @Positive(message = "Deposit amount must be positive")
    @Digits(integer = 17, fraction = 2, message = "Amount must be in whole cents")
    private BigDecimal depositAmount;

    @NotNull(message = "Currency is required")
    private Currency currency;
}

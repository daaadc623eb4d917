package com.lendingledger.api.dto;

import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * DTO for minting units of a catalog item to the custodian.
 */
@Data
public class MintRequest {

    @Positive(message = "Quantity must be positive")
    private long quantity;
}

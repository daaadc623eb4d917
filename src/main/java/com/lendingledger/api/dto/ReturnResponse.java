package com.lendingledger.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response to a return: whether the deposit was forfeited for lateness.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReturnResponse {

    private String borrowerId;
    private Long itemId;
    private boolean late;
}

package com.lendingledger.api.dto;

import com.lendingledger.loan.Loan;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Open loan as returned by the API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanResponse {

    private String borrowerId;
    private Long itemId;
    private String custodianId;
    private Instant dueDate;
    private BigDecimal depositAmount;
    private String currency;
    private int extensionsUsed;
    private Instant openedAt;

    public static LoanResponse from(Loan loan) {
        return LoanResponse.builder()
            .borrowerId(loan.getBorrowerId())
            .itemId(loan.getItemId())
            .custodianId(loan.getCustodianId())
            .dueDate(loan.getDueDate())
            .depositAmount(loan.getDepositAmount().getAmount())
            .currency(loan.getDepositAmount().getCurrency().name())
            .extensionsUsed(loan.getExtensionsUsed())
            .openedAt(loan.getOpenedAt())
            .build();
    }
}

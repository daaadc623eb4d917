package com.lendingledger.rules;

import com.lendingledger.common.exception.LendingErrorCode;
import com.lendingledger.loan.LoanRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that allows at most one open loan per borrower and item.
 */
@Component
@Order(50)
@RequiredArgsConstructor
public class NoActiveLoanRule implements BorrowRule {

    private final LoanRepository loanRepository;

    @Override
    public RuleResult evaluate(BorrowContext context) {
        if (loanRepository.findByBorrowerIdAndItemId(context.getBorrowerId(), context.getItemId()).isPresent()) {
            return RuleResult.decline(LendingErrorCode.ACTIVE_LOAN_EXISTS,
                String.format("%s already has item %d on loan", context.getBorrowerId(), context.getItemId()));
        }
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "NoActiveLoan";
    }
}

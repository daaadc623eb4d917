package com.lendingledger.rules;

import com.lendingledger.common.Money;
import com.lendingledger.common.exception.LendingErrorCode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that enforces the policy deposit as a minimum. Paying more is allowed;
 * the whole amount is escrowed.
 */
@Component
@Order(60)
public class MinimumDepositRule implements BorrowRule {

    @Override
    public RuleResult evaluate(BorrowContext context) {
        Money required = context.getPolicy().getDepositAmount();
        Money paid = context.getPaidDeposit();

        if (paid == null) {
            return RuleResult.decline(LendingErrorCode.DEPOSIT_TOO_LOW,
                String.format("Deposit of %s required, none sent", required));
        }
        if (!paid.isSameCurrency(required)) {
            return RuleResult.decline(LendingErrorCode.DEPOSIT_TOO_LOW,
                String.format("Deposit must be paid in %s, got %s", required.getCurrency(), paid.getCurrency()));
        }
        if (paid.isLessThan(required)) {
            return RuleResult.decline(LendingErrorCode.DEPOSIT_TOO_LOW,
                String.format("Deposit %s is below the required %s", paid, required));
        }
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "MinimumDeposit";
    }
}

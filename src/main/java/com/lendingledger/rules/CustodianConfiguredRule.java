package com.lendingledger.rules;

import com.lendingledger.common.exception.LendingErrorCode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that requires a custodian to lend units from.
 */
@Component
@Order(30)
public class CustodianConfiguredRule implements BorrowRule {

    @Override
    public RuleResult evaluate(BorrowContext context) {
        if (!context.getPolicy().isCustodianConfigured()) {
            return RuleResult.decline(LendingErrorCode.BRANCH_UNSET, "No custodian is configured");
        }
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "CustodianConfigured";
    }
}

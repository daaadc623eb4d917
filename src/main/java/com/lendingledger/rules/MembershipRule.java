package com.lendingledger.rules;

import com.lendingledger.common.exception.LendingErrorCode;
import com.lendingledger.membership.MembershipOracle;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that only lets current members borrow.
 */
@Component
@Order(10)
@RequiredArgsConstructor
public class MembershipRule implements BorrowRule {

    private final MembershipOracle membershipOracle;

    @Override
    public RuleResult evaluate(BorrowContext context) {
        if (!membershipOracle.isMember(context.getBorrowerId())) {
            return RuleResult.decline(LendingErrorCode.NOT_MEMBER,
                "Account " + context.getBorrowerId() + " does not hold borrowing rights");
        }
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "Membership";
    }
}

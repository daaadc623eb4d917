package com.lendingledger.rules;

import com.lendingledger.common.exception.LendingErrorCode;
import com.lendingledger.inventory.InventoryLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that requires the custodian to have a unit of the item on hand for
 * someone other than itself.
 */
@Component
@Order(70)
@RequiredArgsConstructor
public class UnitAvailableRule implements BorrowRule {

    private final InventoryLedger inventoryLedger;

    @Override
    public RuleResult evaluate(BorrowContext context) {
        String custodianId = context.getPolicy().getCustodianId();
        if (custodianId.equals(context.getBorrowerId())) {
            return RuleResult.decline(LendingErrorCode.UNAVAILABLE,
                "Custodian " + custodianId + " cannot borrow units it already holds");
        }
        if (inventoryLedger.balanceOf(custodianId, context.getItemId()) <= 0) {
            return RuleResult.decline(LendingErrorCode.UNAVAILABLE,
                String.format("Custodian %s has no units of item %d available", custodianId, context.getItemId()));
        }
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "UnitAvailable";
    }
}

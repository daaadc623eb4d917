package com.lendingledger.rules;

import com.lendingledger.catalog.CatalogService;
import com.lendingledger.common.exception.LendingErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that rejects borrows of unknown catalog items.
 */
@Component
@Order(20)
@RequiredArgsConstructor
public class ItemExistsRule implements BorrowRule {

    private final CatalogService catalogService;

    @Override
    public RuleResult evaluate(BorrowContext context) {
        if (catalogService.findItem(context.getItemId()).isEmpty()) {
            return RuleResult.decline(LendingErrorCode.NO_SUCH_ITEM,
                "Catalog item not found: " + context.getItemId());
        }
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "ItemExists";
    }
}

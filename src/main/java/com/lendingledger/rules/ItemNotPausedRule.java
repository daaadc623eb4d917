package com.lendingledger.rules;

import com.lendingledger.catalog.CatalogItem;
import com.lendingledger.catalog.CatalogService;
import com.lendingledger.common.exception.LendingErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that blocks new loans of paused items.
 */
@Component
@Order(40)
@RequiredArgsConstructor
public class ItemNotPausedRule implements BorrowRule {

    private final CatalogService catalogService;

    @Override
    public RuleResult evaluate(BorrowContext context) {
        boolean paused = catalogService.findItem(context.getItemId())
            .map(CatalogItem::isPaused)
            .orElse(false);

        if (paused) {
            return RuleResult.decline(LendingErrorCode.ITEM_PAUSED,
                "Catalog item " + context.getItemId() + " is paused");
        }
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "ItemNotPaused";
    }
}

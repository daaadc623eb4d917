package com.lendingledger.catalog;

import com.lendingledger.common.exception.InvalidValueException;
import com.lendingledger.common.exception.LendingErrorCode;
import com.lendingledger.common.exception.ResourceNotFoundException;
import com.lendingledger.inventory.InventoryLedger;
import com.lendingledger.policy.AccessPolicy;
import com.lendingledger.policy.LendingPolicy;
import com.lendingledger.policy.PolicyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Service for catalog items and the units minted for them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogService {

    private final CatalogItemRepository itemRepository;
    private final InventoryLedger inventoryLedger;
    private final PolicyService policyService;
    private final Clock clock;

    @Transactional
    public CatalogItem createItem(AccessPolicy access, ItemMetadata metadata) {
        access.requireSteward("create catalog items");
        validate(metadata);

        CatalogItem item = itemRepository.save(new CatalogItem(metadata, clock.instant()));
        log.info("Created catalog item {} '{}' by {}", item.getId(), item.getTitle(), access.getCallerId());
        return item;
    }

    @Transactional
    public CatalogItem updateMetadata(AccessPolicy access, Long itemId, ItemMetadata metadata) {
        access.requireStewardOrCurator("update item metadata");
        validate(metadata);

        CatalogItem item = getItem(itemId);
        item.applyMetadata(metadata, clock.instant());
        log.info("Updated metadata of catalog item {} by {}", itemId, access.getCallerId());
        return itemRepository.save(item);
    }

    @Transactional
    public CatalogItem setPaused(AccessPolicy access, Long itemId, boolean paused) {
        access.requireStewardOrCurator(paused ? "pause items" : "unpause items");

        CatalogItem item = getItem(itemId);
        if (paused) {
            item.pause(clock.instant());
        } else {
            item.unpause(clock.instant());
        }
        log.info("Catalog item {} {} by {}", itemId, paused ? "paused" : "unpaused", access.getCallerId());
        return itemRepository.save(item);
    }

    /**
     * Mint new units of an item to the configured custodian.
     *
     * @return the custodian's unit balance after minting
     */
    @Transactional
    public long mintUnits(AccessPolicy access, Long itemId, long quantity) {
        access.requireSteward("mint units");
        if (quantity <= 0) {
            throw new InvalidValueException(LendingErrorCode.INVALID_AMOUNT,
                "Quantity to mint must be positive: " + quantity);
        }
        getItem(itemId);

        LendingPolicy policy = policyService.current();
        if (!policy.isCustodianConfigured()) {
            throw new InvalidValueException(LendingErrorCode.BRANCH_UNSET, "No custodian is configured");
        }

        inventoryLedger.mint(policy.getCustodianId(), itemId, quantity);
        long balance = inventoryLedger.balanceOf(policy.getCustodianId(), itemId);
        log.info("Minted {} units of item {} to custodian {}, balance now {}",
            quantity, itemId, policy.getCustodianId(), balance);
        return balance;
    }

    @Transactional(readOnly = true)
    public CatalogItem getItem(Long itemId) {
        return findItem(itemId)
            .orElseThrow(() -> ResourceNotFoundException.item(itemId));
    }

    @Transactional(readOnly = true)
    public Optional<CatalogItem> findItem(Long itemId) {
        if (itemId == null) {
            return Optional.empty();
        }
        return itemRepository.findById(itemId);
    }

    @Transactional(readOnly = true)
    public List<CatalogItem> listAvailableItems() {
        return itemRepository.findByPausedFalseOrderByIdAsc();
    }

    private static void validate(ItemMetadata metadata) {
        if (metadata == null || metadata.getTitle() == null || metadata.getTitle().isBlank()) {
            throw new InvalidValueException(LendingErrorCode.MISSING_METADATA, "Item title is required");
        }
    }
}

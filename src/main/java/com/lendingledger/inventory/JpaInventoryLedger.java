package com.lendingledger.inventory;

import com.lendingledger.common.exception.InvalidValueException;
import com.lendingledger.common.exception.LendingErrorCode;
import com.lendingledger.common.exception.StateConflictException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;

/**
 * Inventory ledger kept in the local database.
 *
 * Holdings are shared between loan keys (every borrower of an item draws on
 * the same custodian row), so they are read with a pessimistic write lock.
 * Both sides of a transfer are locked in holder-id order to keep concurrent
 * transfers from waiting on each other in a cycle. A holding already in the
 * persistence context is refreshed once its lock is held, so the quantity
 * checked is the committed one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaInventoryLedger implements InventoryLedger {

    private final UnitHoldingRepository holdingRepository;
    private final EntityManager entityManager;

    @Override
    @Transactional(readOnly = true)
    public long balanceOf(String holderId, Long itemId) {
        return holdingRepository.findQuantity(holderId, itemId).orElse(0L);
    }

    @Override
    @Transactional
    public void transfer(String fromId, String toId, Long itemId, long quantity) {
        requirePositive(quantity);
        if (fromId.equals(toId)) {
            throw new InvalidValueException(LendingErrorCode.INVALID_ACCOUNT,
                "Cannot transfer units from a holder to itself: " + fromId);
        }

        List<String> ordered = List.of(fromId, toId).stream()
            .sorted(Comparator.naturalOrder())
            .toList();
        UnitHolding first = lockHolding(ordered.get(0), itemId);
        UnitHolding second = lockHolding(ordered.get(1), itemId);
        UnitHolding from = first.getHolderId().equals(fromId) ? first : second;
        UnitHolding to = from == first ? second : first;

        if (from.getQuantity() < quantity) {
            throw new StateConflictException(LendingErrorCode.INSUFFICIENT_UNITS,
                String.format("Holder %s has %d units of item %d, cannot transfer %d",
                    fromId, from.getQuantity(), itemId, quantity));
        }

        from.debit(quantity);
        to.credit(quantity);
        holdingRepository.save(from);
        holdingRepository.save(to);

        log.debug("Transferred {} units of item {} from {} to {}", quantity, itemId, fromId, toId);
    }

    @Override
    @Transactional
    public void mint(String holderId, Long itemId, long quantity) {
        requirePositive(quantity);

        UnitHolding holding = lockHolding(holderId, itemId);
        holding.credit(quantity);
        holdingRepository.save(holding);

        log.debug("Minted {} units of item {} to {}", quantity, itemId, holderId);
    }

    private UnitHolding lockHolding(String holderId, Long itemId) {
        return holdingRepository.findForUpdate(holderId, itemId)
            .map(holding -> {
                entityManager.refresh(holding, LockModeType.PESSIMISTIC_WRITE);
                return holding;
            })
            .orElseGet(() -> holdingRepository.save(new UnitHolding(holderId, itemId)));
    }

    private static void requirePositive(long quantity) {
        if (quantity <= 0) {
            throw new InvalidValueException(LendingErrorCode.INVALID_AMOUNT,
                "Unit quantity must be positive: " + quantity);
        }
    }
}

package com.lendingledger.inventory;

/**
 * Unit balances of catalog items per holder.
 *
 * A holder is either the custodian (branch) keeping unborrowed copies or a
 * borrower keeping a borrowed one. Units are fungible within an item.
 */
public interface InventoryLedger {

    /**
     * Number of units of the item the holder currently has.
     */
    long balanceOf(String holderId, Long itemId);

    /**
     * Move units between holders.
     *
     * @throws com.lendingledger.common.exception.StateConflictException if the
     *         sender holds fewer than {@code quantity} units
     */
    void transfer(String fromId, String toId, Long itemId, long quantity);

    /**
     * Create new units out of nothing and credit them to the holder.
     */
    void mint(String holderId, Long itemId, long quantity);
}

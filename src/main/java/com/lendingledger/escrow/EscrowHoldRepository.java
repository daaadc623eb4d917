package com.lendingledger.escrow;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for escrow holds.
 */
@Repository
public interface EscrowHoldRepository extends JpaRepository<EscrowHold, Long> {

    Optional<EscrowHold> findByBorrowerIdAndItemId(String borrowerId, Long itemId);

    List<EscrowHold> findByBorrowerId(String borrowerId);
}

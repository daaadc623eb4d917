package com.lendingledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for ledger entries.
 */
@Repository
public interface LedgerRepository extends JpaRepository<LedgerEntry, String> {

    List<LedgerEntry> findByBorrowerIdOrderByCreatedAtAsc(String borrowerId);

    List<LedgerEntry> findByItemIdOrderByCreatedAtAsc(Long itemId);

    List<LedgerEntry> findByBorrowerIdAndItemIdOrderByCreatedAtAsc(String borrowerId, Long itemId);

    List<LedgerEntry> findByEventTypeOrderByCreatedAtAsc(LedgerEventType eventType);
}

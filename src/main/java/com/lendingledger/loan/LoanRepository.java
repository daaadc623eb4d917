package com.lendingledger.loan;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for open loans.
 */
@Repository
public interface LoanRepository extends JpaRepository<Loan, Long> {

    Optional<Loan> findByBorrowerIdAndItemId(String borrowerId, Long itemId);

    List<Loan> findByBorrowerIdOrderByDueDateAsc(String borrowerId);

    List<Loan> findByDueDateBeforeOrderByDueDateAsc(Instant instant);
}

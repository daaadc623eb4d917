package com.lendingledger.loan;

import com.lendingledger.common.LoanKey;
import com.lendingledger.common.Money;
import com.lendingledger.policy.PolicyService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for loan operations.
 *
 * Each transition takes the per-key lock, reads the clock, and runs the
 * transactional transition while still holding the lock. Queries report an
 * absent loan as a zero due date and a zero deposit.
 */
@Service
@RequiredArgsConstructor
public class LoanLedger {

    private final LoanTransitionService transitions;
    private final LoanRepository loanRepository;
    private final LoanKeyLock keyLock;
    private final PolicyService policyService;
    private final Clock clock;

    /**
     * @return the due date of the new loan
     */
    public Instant borrow(String borrowerId, Long itemId, Money paidDeposit) {
        return openLoan(borrowerId, itemId, paidDeposit).getDueDate();
    }

    /**
     * Same as {@link #borrow} but returns the loan as it was committed, for
     * callers that report it without reading it back outside the lock.
     */
    public Loan openLoan(String borrowerId, Long itemId, Money paidDeposit) {
        return keyLock.executeWithLock(LoanKey.of(borrowerId, itemId),
            () -> transitions.borrow(borrowerId, itemId, paidDeposit, clock.instant()));
    }

    public boolean returnItem(String borrowerId, Long itemId) {
        return keyLock.executeWithLock(LoanKey.of(borrowerId, itemId),
            () -> transitions.returnItem(borrowerId, itemId, clock.instant()));
    }

    public ExtensionResult requestExtension(String borrowerId, Long itemId) {
        return keyLock.executeWithLock(LoanKey.of(borrowerId, itemId),
            () -> transitions.requestExtension(borrowerId, itemId, clock.instant()));
    }

    /**
     * @return the due date, or {@link Instant#EPOCH} if there is no open loan
     */
    @Transactional(readOnly = true)
    public Instant loanDueDate(String borrowerId, Long itemId) {
        return findLoan(borrowerId, itemId)
            .map(Loan::getDueDate)
            .orElse(Instant.EPOCH);
    }

    /**
     * @return the escrowed deposit, or zero in the policy currency if there is no open loan
     */
    @Transactional(readOnly = true)
    public Money loanDeposit(String borrowerId, Long itemId) {
        return findLoan(borrowerId, itemId)
            .map(Loan::getDepositAmount)
            .orElseGet(() -> Money.zero(policyService.current().getCurrency()));
    }

    @Transactional(readOnly = true)
    public Optional<Loan> findLoan(String borrowerId, Long itemId) {
        return loanRepository.findByBorrowerIdAndItemId(borrowerId, itemId);
    }

    @Transactional(readOnly = true)
    public List<Loan> loansOf(String borrowerId) {
        return loanRepository.findByBorrowerIdOrderByDueDateAsc(borrowerId);
    }

    /**
     * Loans whose due date has passed, whether or not they are still in grace.
     */
    @Transactional(readOnly = true)
    public List<Loan> overdueLoans() {
        return loanRepository.findByDueDateBeforeOrderByDueDateAsc(clock.instant());
    }
}

package com.lendingledger.loan;

import com.lendingledger.common.LoanKey;
import com.lendingledger.common.Money;
import com.lendingledger.common.exception.LendingErrorCode;
import com.lendingledger.common.exception.ResourceNotFoundException;
import com.lendingledger.common.exception.StateConflictException;
import com.lendingledger.escrow.EscrowVault;
import com.lendingledger.funds.FundsSink;
import com.lendingledger.inventory.InventoryLedger;
import com.lendingledger.ledger.LedgerService;
import com.lendingledger.policy.LendingPolicy;
import com.lendingledger.policy.PolicyService;
import com.lendingledger.rules.BorrowContext;
import com.lendingledger.rules.BorrowRulesEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * The loan state machine: borrow, return and extend for one (borrower, item) key.
 *
 * Each transition is one transaction taking an explicit {@code now}, and either
 * commits all of its effects or none. Callers serialize transitions per key;
 * see {@link LoanLedger}.
 *
 * Borrow flow:
 * 1. Run the borrow rules in order
 * 2. Open the loan with due date now + loan duration
 * 3. Move one unit from the custodian to the borrower
 * 4. Lock the paid deposit in escrow and credit the funds sink
 *
 * Return flow:
 * 1. Check the loan exists and the borrower still holds the unit
 * 2. Move the unit back and close the loan
 * 3. Release the deposit (on time) or forfeit it to the pool (late)
 * 4. Pay the released deposit out to the borrower, last
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanTransitionService {

    private final LoanRepository loanRepository;
    private final PolicyService policyService;
    private final BorrowRulesEngine rulesEngine;
    private final InventoryLedger inventoryLedger;
    private final EscrowVault escrowVault;
    private final FundsSink fundsSink;
    private final LedgerService ledgerService;

    /**
     * @return the new loan as committed
     */
    @Transactional
    public Loan borrow(String borrowerId, Long itemId, Money paidDeposit, Instant now) {
        LendingPolicy policy = policyService.current();
        BorrowContext context = BorrowContext.builder()
            .borrowerId(borrowerId)
            .itemId(itemId)
            .paidDeposit(paidDeposit)
            .now(now)
            .policy(policy)
            .build();

        log.info("Processing borrow of item {} by {} with deposit {}", itemId, borrowerId, paidDeposit);
        rulesEngine.requireApproval(context);

        LoanKey key = context.key();
        String custodianId = policy.getCustodianId();
        Instant dueDate = now.plus(policy.getLoanDuration());

        Loan loan = loanRepository.save(new Loan(key, custodianId, dueDate, paidDeposit, now));
        try {
            inventoryLedger.transfer(custodianId, borrowerId, itemId, 1);
        } catch (StateConflictException e) {
            // the custodian's last unit went to a concurrent borrow of another key
            throw new StateConflictException(LendingErrorCode.UNAVAILABLE,
                String.format("Custodian %s has no units of item %d available", custodianId, itemId));
        }
        escrowVault.lock(key, paidDeposit);
        fundsSink.received(paidDeposit);
        ledgerService.recordLoanOpened(key, custodianId, paidDeposit, dueDate);

        log.info("Loan {} opened, due {}", key, dueDate);
        return loan;
    }

    /**
     * @return true if the return was late and the deposit was forfeited
     */
    @Transactional
    public boolean returnItem(String borrowerId, Long itemId, Instant now) {
        log.info("Processing return of item {} by {}", itemId, borrowerId);

        Loan loan = loanRepository.findByBorrowerIdAndItemId(borrowerId, itemId)
            .orElseThrow(() -> ResourceNotFoundException.loan(borrowerId, itemId));
        if (inventoryLedger.balanceOf(borrowerId, itemId) <= 0) {
            throw new StateConflictException(LendingErrorCode.NOT_HOLDER,
                String.format("%s no longer holds a unit of item %d", borrowerId, itemId));
        }

        LendingPolicy policy = policyService.current();
        LoanKey key = loan.key();
        boolean late = loan.isLateAt(now, policy.getGracePeriod());

        inventoryLedger.transfer(borrowerId, loan.getCustodianId(), itemId, 1);
        loanRepository.delete(loan);
        ledgerService.recordLoanReturned(key, loan.getCustodianId(), late);

        if (late) {
            Money forfeited = escrowVault.forfeit(key);
            log.info("Loan {} returned late at {} (due {}), deposit {} forfeited",
                key, now, loan.getDueDate(), forfeited);
        } else {
            Money refund = escrowVault.release(key);
            log.info("Loan {} returned on time at {} (due {}), refunding {}",
                key, now, loan.getDueDate(), refund);
            fundsSink.payOut(borrowerId, refund);
        }
        return late;
    }

    @Transactional
    public ExtensionResult requestExtension(String borrowerId, Long itemId, Instant now) {
        Loan loan = loanRepository.findByBorrowerIdAndItemId(borrowerId, itemId)
            .filter(open -> !open.isPastDue(now))
            .orElseThrow(() -> new StateConflictException(LendingErrorCode.NO_ACTIVE_LOAN,
                String.format("No loan of item %d to %s that is still within its due date", itemId, borrowerId)));

        LendingPolicy policy = policyService.current();
        if (loan.getExtensionsUsed() >= policy.getMaxExtensions()) {
            throw new StateConflictException(LendingErrorCode.MAX_EXTENSIONS_REACHED,
                String.format("Loan %s has used %d of %d extensions",
                    loan.key(), loan.getExtensionsUsed(), policy.getMaxExtensions()));
        }

        loan.extend(policy.getExtensionDuration());
        loanRepository.save(loan);
        ledgerService.recordLoanExtended(loan.key(), loan.getDueDate(), loan.getExtensionsUsed());

        log.info("Loan {} extended to {} ({} used)", loan.key(), loan.getDueDate(), loan.getExtensionsUsed());
        return new ExtensionResult(loan.getDueDate(), loan.getExtensionsUsed());
    }
}

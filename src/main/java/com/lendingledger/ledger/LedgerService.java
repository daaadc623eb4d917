package com.lendingledger.ledger;

import com.lendingledger.common.LoanKey;
import com.lendingledger.common.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Service for the append-only lending ledger.
 *
 * Every loan transition and every escrow movement is recorded here, inside the
 * transaction that performs it, so a rolled back transition leaves no entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final LedgerRepository ledgerRepository;
    private final Clock clock;

    @Transactional
    public LedgerEntry recordLoanOpened(LoanKey key, String custodianId, Money deposit, Instant dueDate) {
        return record(LedgerEventType.LOAN_OPENED, key, custodianId, deposit, "Loan opened, due " + dueDate);
    }

    @Transactional
    public LedgerEntry recordLoanExtended(LoanKey key, Instant newDueDate, int extensionsUsed) {
        return record(LedgerEventType.LOAN_EXTENDED, key, null, null,
            String.format("Extension %d, due %s", extensionsUsed, newDueDate));
    }

    @Transactional
    public LedgerEntry recordLoanReturned(LoanKey key, String custodianId, boolean late) {
        LedgerEventType type = late ? LedgerEventType.LOAN_RETURNED_LATE : LedgerEventType.LOAN_RETURNED;
        return record(type, key, custodianId, null, late ? "Returned late" : "Returned on time");
    }

    @Transactional
    public LedgerEntry recordDepositLocked(LoanKey key, Money amount) {
        return record(LedgerEventType.DEPOSIT_LOCKED, key, null, amount, "Deposit locked in escrow");
    }

    @Transactional
    public LedgerEntry recordDepositReleased(LoanKey key, Money amount) {
        return record(LedgerEventType.DEPOSIT_RELEASED, key, key.getBorrowerId(), amount,
            "Deposit released to borrower");
    }

    @Transactional
    public LedgerEntry recordDepositForfeited(LoanKey key, Money amount) {
        return record(LedgerEventType.DEPOSIT_FORFEITED, key, null, amount,
            "Deposit forfeited to pool");
    }

    @Transactional
    public LedgerEntry recordPoolWithdrawal(String toAccountId, Money amount, String stewardId) {
        LedgerEntry entry = new LedgerEntry(
            LedgerEventType.POOL_WITHDRAWAL,
            null,
            null,
            toAccountId,
            amount,
            "Pool withdrawal by " + stewardId,
            clock.instant()
        );
        ledgerRepository.save(entry);

        log.info("Recorded POOL_WITHDRAWAL: entry={}, to={}, amount={}", entry.getEntryId(), toAccountId, amount);
        return entry;
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getBorrowerLedger(String borrowerId) {
        return ledgerRepository.findByBorrowerIdOrderByCreatedAtAsc(borrowerId);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getItemLedger(Long itemId) {
        return ledgerRepository.findByItemIdOrderByCreatedAtAsc(itemId);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getLoanLedger(LoanKey key) {
        return ledgerRepository.findByBorrowerIdAndItemIdOrderByCreatedAtAsc(key.getBorrowerId(), key.getItemId());
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getEvents(LedgerEventType eventType) {
        return ledgerRepository.findByEventTypeOrderByCreatedAtAsc(eventType);
    }

    private LedgerEntry record(LedgerEventType type, LoanKey key, String counterpartyId,
                               Money amount, String description) {
        LedgerEntry entry = new LedgerEntry(
            type,
            key.getBorrowerId(),
            key.getItemId(),
            counterpartyId,
            amount,
            description,
            clock.instant()
        );
        ledgerRepository.save(entry);

        log.info("Recorded {}: entry={}, loan={}, amount={}", type, entry.getEntryId(), key, amount);
        return entry;
    }
}

package com.lendingledger.escrow;

import com.lendingledger.common.LoanKey;
import com.lendingledger.common.Money;
import com.lendingledger.common.exception.InsufficientFundsException;
import com.lendingledger.common.exception.InvalidValueException;
import com.lendingledger.common.exception.LendingErrorCode;
import com.lendingledger.funds.FundsSink;
import com.lendingledger.ledger.LedgerService;
import com.lendingledger.policy.AccessPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * Holds loan deposits and the pool of forfeited ones.
 *
 * Escrow lifecycle per loan key:
 * 1. lock() when the borrow succeeds
 * 2. release() on a timely return - the caller pays the amount back out
 * 3. forfeit() on a late return - the amount joins the pool
 *
 * Exactly one of release() or forfeit() ends a hold.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowVault {

    private final EscrowHoldRepository holdRepository;
    private final ForfeitedPoolRepository poolRepository;
    private final FundsSink fundsSink;
    private final LedgerService ledgerService;
    private final Clock clock;

    @Transactional
    public void lock(LoanKey key, Money amount) {
        if (amount == null || !amount.isPositive()) {
            throw new InvalidValueException(LendingErrorCode.INVALID_AMOUNT,
                "Escrowed amount must be positive: " + amount);
        }
        if (holdRepository.findByBorrowerIdAndItemId(key.getBorrowerId(), key.getItemId()).isPresent()) {
            throw new IllegalStateException("Loan already has escrowed funds: " + key);
        }

        holdRepository.save(new EscrowHold(key, amount, clock.instant()));
        ledgerService.recordDepositLocked(key, amount);

        log.info("Locked {} in escrow for loan {}", amount, key);
    }

    /**
     * Remove the hold and hand its amount back to the caller for payout.
     *
     * @return the amount that was held
     */
    @Transactional
    public Money release(LoanKey key) {
        EscrowHold hold = requireHold(key);
        holdRepository.delete(hold);
        ledgerService.recordDepositReleased(key, hold.getAmount());

        log.info("Released {} from escrow for loan {}", hold.getAmount(), key);
        return hold.getAmount();
    }

    /**
     * Remove the hold and add its amount to the forfeited pool.
     *
     * @return the amount that was forfeited
     */
    @Transactional
    public Money forfeit(LoanKey key) {
        EscrowHold hold = requireHold(key);
        holdRepository.delete(hold);

        ForfeitedPool pool = lockPool();
        pool.add(hold.getAmount(), clock.instant());
        poolRepository.save(pool);
        ledgerService.recordDepositForfeited(key, hold.getAmount());

        log.info("Forfeited {} from loan {} to pool, pool balance {}", hold.getAmount(), key, pool.getBalance());
        return hold.getAmount();
    }

    /**
     * Steward-only withdrawal from the forfeited pool. The pool is decremented
     * before the funds sink pays out.
     */
    @Transactional
    public Money withdrawPool(AccessPolicy access, String toAccountId, Money amount) {
        access.requireSteward("withdraw from the forfeited pool");
        if (toAccountId == null || toAccountId.isBlank()) {
            throw new InvalidValueException(LendingErrorCode.INVALID_ACCOUNT, "Withdrawal recipient cannot be blank");
        }
        if (amount == null || !amount.isPositive()) {
            throw new InvalidValueException(LendingErrorCode.INVALID_AMOUNT,
                "Withdrawal amount must be positive: " + amount);
        }

        ForfeitedPool pool = lockPool();
        if (!pool.getBalance().isSameCurrency(amount)) {
            throw new InvalidValueException(LendingErrorCode.INVALID_AMOUNT,
                String.format("Pool holds %s, cannot withdraw %s", pool.getBalance().getCurrency(), amount.getCurrency()));
        }
        if (amount.isGreaterThan(pool.getBalance())) {
            throw new InsufficientFundsException("forfeited pool", amount, pool.getBalance());
        }

        pool.withdraw(amount, clock.instant());
        poolRepository.save(pool);
        ledgerService.recordPoolWithdrawal(toAccountId, amount, access.getCallerId());

        log.info("Steward {} withdrew {} from pool to {}, pool balance {}",
            access.getCallerId(), amount, toAccountId, pool.getBalance());

        fundsSink.payOut(toAccountId, amount);
        return pool.getBalance();
    }

    @Transactional(readOnly = true)
    public Money poolBalance() {
        return poolRepository.findById(ForfeitedPool.SINGLETON_ID)
            .map(ForfeitedPool::getBalance)
            .orElseThrow(() -> new IllegalStateException("Forfeited pool has not been initialized"));
    }

    @Transactional(readOnly = true)
    public Optional<Money> heldFor(LoanKey key) {
        return holdRepository.findByBorrowerIdAndItemId(key.getBorrowerId(), key.getItemId())
            .map(EscrowHold::getAmount);
    }

    private EscrowHold requireHold(LoanKey key) {
        return holdRepository.findByBorrowerIdAndItemId(key.getBorrowerId(), key.getItemId())
            .orElseThrow(() -> new IllegalStateException("No escrowed funds for loan: " + key));
    }

    private ForfeitedPool lockPool() {
        return poolRepository.findForUpdate(ForfeitedPool.SINGLETON_ID)
            .orElseThrow(() -> new IllegalStateException("Forfeited pool has not been initialized"));
    }
}

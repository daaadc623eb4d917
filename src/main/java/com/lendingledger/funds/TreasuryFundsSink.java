package com.lendingledger.funds;

import com.lendingledger.common.Money;
import com.lendingledger.common.exception.InsufficientFundsException;
import com.lendingledger.common.exception.InvalidValueException;
import com.lendingledger.common.exception.LendingErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Funds sink backed by the internal {@link Treasury}.
 *
 * Payouts are settled by debiting the treasury; moving the money to the payee's
 * real account is left to whatever consumes the ledger's refund entries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TreasuryFundsSink implements FundsSink {

    private final TreasuryRepository treasuryRepository;
    private final Clock clock;

    @Override
    @Transactional
    public void received(Money amount) {
        requirePositive(amount);

        Treasury treasury = lockTreasury();
        treasury.credit(amount, clock.instant());
        treasuryRepository.save(treasury);

        log.info("Treasury received {}, balance {}", amount, treasury.getBalance());
    }

    @Override
    @Transactional
    public void payOut(String toAccountId, Money amount) {
        requirePositive(amount);

        Treasury treasury = lockTreasury();
        if (treasury.getBalance().isLessThan(amount)) {
            throw new InsufficientFundsException("treasury", amount, treasury.getBalance());
        }
        treasury.debit(amount, clock.instant());
        treasuryRepository.save(treasury);

        log.info("Treasury paid {} to {}, balance {}", amount, toAccountId, treasury.getBalance());
    }

    @Override
    @Transactional(readOnly = true)
    public Money getBalance() {
        return treasuryRepository.findById(Treasury.SINGLETON_ID)
            .map(Treasury::getBalance)
            .orElseThrow(() -> new IllegalStateException("Treasury has not been initialized"));
    }

    private Treasury lockTreasury() {
        return treasuryRepository.findForUpdate(Treasury.SINGLETON_ID)
            .orElseThrow(() -> new IllegalStateException("Treasury has not been initialized"));
    }

    private static void requirePositive(Money amount) {
        if (amount == null || !amount.isPositive()) {
            throw new InvalidValueException(LendingErrorCode.INVALID_AMOUNT,
                "Transfer amount must be positive: " + amount);
        }
    }
}

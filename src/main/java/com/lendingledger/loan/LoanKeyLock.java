package com.lendingledger.loan;

import com.google.common.util.concurrent.Striped;
import com.lendingledger.common.LoanKey;
import com.lendingledger.common.exception.LockAcquisitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Serializes loan transitions per (borrower, item) key.
 *
 * Keys hash onto a fixed number of lock stripes, so two keys may share a
 * stripe; that only costs throughput. The lock is held around the whole
 * transaction, which therefore commits before another transition on the same
 * key can read the loan.
 */
@Component
@Slf4j
public class LoanKeyLock {

    private final Striped<Lock> locks;
    private final Duration waitTimeout;

    public LoanKeyLock(
            @Value("${lending-ledger.lock.stripes:128}") int stripes,
            @Value("${lending-ledger.lock.wait-timeout-ms:5000}") long waitTimeoutMs) {
        this.locks = Striped.lock(stripes);
        this.waitTimeout = Duration.ofMillis(waitTimeoutMs);
    }

    public <T> T executeWithLock(LoanKey key, Supplier<T> task) {
        Lock lock = locks.get(key);
        try {
            if (!lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Could not lock loan {} within {}", key, waitTimeout);
                throw new LockAcquisitionException(
                    String.format("Loan %s is busy, lock not acquired within %s", key, waitTimeout));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while waiting for the lock of loan " + key);
        }

        try {
            return task.get();
        } finally {
            lock.unlock();
        }
    }
}

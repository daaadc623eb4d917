package com.lendingledger.loan;

import com.lendingledger.common.Currency;
import com.lendingledger.common.Money;
import com.lendingledger.common.exception.LendingErrorCode;
import com.lendingledger.common.exception.LendingException;
import com.lendingledger.escrow.EscrowVault;
import com.lendingledger.common.LoanKey;
import com.lendingledger.inventory.InventoryLedger;
import com.lendingledger.support.LendingFixtures;
import com.lendingledger.support.MutableClock;
import com.lendingledger.support.TestClockConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent borrows against the same loan key and the same last unit.
 *
 * Not transactional: each borrow commits in its own transaction, as it would
 * in production.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class LoanConcurrencyTest {

    private static final int THREADS = 8;
    private static final Money DEPOSIT = Money.of("10.00", Currency.USD);

    @Autowired
    private LoanLedger loanLedger;

    @Autowired
    private InventoryLedger inventoryLedger;

    @Autowired
    private EscrowVault escrowVault;

    @Autowired
    private LendingFixtures fixtures;

    @Autowired
    private MutableClock clock;

    private final List<LoanKey> openedLoans = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        clock.setInstant(TestClockConfig.START);
    }

    @AfterEach
    void returnOpenedLoans() {
        for (LoanKey key : openedLoans) {
            loanLedger.returnItem(key.getBorrowerId(), key.getItemId());
        }
        openedLoans.clear();
    }

    @Test
    void testConcurrentBorrowsOfSameKeyOpenOneLoan() throws Exception {
        Long itemId = fixtures.itemWithUnits("Concurrent Same Key", THREADS);
        String borrower = "racer-same-key";
        fixtures.member(borrower);

        List<Throwable> failures = runConcurrently(THREADS, index -> {
            loanLedger.borrow(borrower, itemId, DEPOSIT);
            openedLoans.add(LoanKey.of(borrower, itemId));
        });

        assertEquals(1, openedLoans.size());
        assertEquals(THREADS - 1, failures.size());
        for (Throwable failure : failures) {
            LendingException e = assertInstanceOf(LendingException.class, failure);
            assertEquals(LendingErrorCode.ACTIVE_LOAN_EXISTS, e.getErrorCode());
        }
        assertEquals(1, inventoryLedger.balanceOf(borrower, itemId));
        assertEquals(THREADS - 1, inventoryLedger.balanceOf(LendingFixtures.CUSTODIAN, itemId));
        assertTrue(escrowVault.heldFor(LoanKey.of(borrower, itemId)).orElseThrow().isEqualTo(DEPOSIT));
    }

    @Test
    void testConcurrentBorrowsOfLastUnitOpenOneLoan() throws Exception {
        Long itemId = fixtures.itemWithUnits("Concurrent Last Unit", 1);
        List<String> borrowers = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            String borrower = "racer-last-unit-" + i;
            fixtures.member(borrower);
            borrowers.add(borrower);
        }

        List<Throwable> failures = runConcurrently(THREADS, index -> {
            String borrower = borrowers.get(index);
            loanLedger.borrow(borrower, itemId, DEPOSIT);
            openedLoans.add(LoanKey.of(borrower, itemId));
        });

        assertEquals(1, openedLoans.size());
        assertEquals(THREADS - 1, failures.size());
        assertEquals(0, inventoryLedger.balanceOf(LendingFixtures.CUSTODIAN, itemId));

        String winner = openedLoans.get(0).getBorrowerId();
        for (String borrower : borrowers) {
            long expected = borrower.equals(winner) ? 1 : 0;
            assertEquals(expected, inventoryLedger.balanceOf(borrower, itemId));
            assertEquals(expected == 1, loanLedger.findLoan(borrower, itemId).isPresent());
        }
    }

    private List<Throwable> runConcurrently(int threads, IndexedTask task) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Throwable> failures = new CopyOnWriteArrayList<>();
        AtomicInteger index = new AtomicInteger();

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    int myIndex = index.getAndIncrement();
                    ready.countDown();
                    try {
                        start.await();
                        task.run(myIndex);
                    } catch (Throwable t) {
                        failures.add(t);
                    }
                }));
            }
            ready.await();
            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } catch (ExecutionException | TimeoutException e) {
            fail("Concurrent task did not complete: " + e);
        } finally {
            executor.shutdownNow();
        }
        return failures;
    }

    @FunctionalInterface
    private interface IndexedTask {
        void run(int index) throws Exception;
    }
}

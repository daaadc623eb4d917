package com.lendingledger.loan;

import com.lendingledger.common.Currency;
import com.lendingledger.common.LoanKey;
import com.lendingledger.common.Money;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for due-date arithmetic on a loan.
 */
class LoanTest {

    private static final Instant OPENED = Instant.parse("2024-03-01T10:00:00Z");
    private static final Instant DUE = OPENED.plus(Duration.ofDays(14));

    private Loan newLoan() {
        return new Loan(LoanKey.of("alice", 1L), "main-branch", DUE, Money.of("10.00", Currency.USD), OPENED);
    }

    @Test
    void testLatenessIsStrict() {
        Loan loan = newLoan();
        Duration grace = Duration.ofHours(1);

        assertFalse(loan.isLateAt(DUE, grace));
        assertFalse(loan.isLateAt(DUE.plus(grace), grace));
        assertTrue(loan.isLateAt(DUE.plus(grace).plusSeconds(1), grace));
        assertTrue(loan.isLateAt(DUE.plusSeconds(1), Duration.ZERO));
    }

    @Test
    void testPastDueIsStrict() {
        Loan loan = newLoan();

        assertFalse(loan.isPastDue(DUE));
        assertTrue(loan.isPastDue(DUE.plusSeconds(1)));
    }

    @Test
    void testExtendAddsDurationAndCounts() {
        Loan loan = newLoan();

        loan.extend(Duration.ofDays(7));
        loan.extend(Duration.ofDays(7));

        assertEquals(DUE.plus(Duration.ofDays(14)), loan.getDueDate());
        assertEquals(2, loan.getExtensionsUsed());
        assertEquals(LoanKey.of("alice", 1L), loan.key());
    }
}

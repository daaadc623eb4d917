package com.lendingledger.loan;

import com.lendingledger.common.Currency;
import com.lendingledger.common.LoanKey;
import com.lendingledger.common.Money;
import com.lendingledger.common.exception.LendingErrorCode;
import com.lendingledger.common.exception.LendingException;
import com.lendingledger.common.exception.NotAuthorizedException;
import com.lendingledger.common.exception.ResourceNotFoundException;
import com.lendingledger.common.exception.StateConflictException;
import com.lendingledger.catalog.CatalogService;
import com.lendingledger.escrow.EscrowVault;
import com.lendingledger.funds.FundsSink;
import com.lendingledger.inventory.InventoryLedger;
import com.lendingledger.ledger.LedgerEntry;
import com.lendingledger.ledger.LedgerEventType;
import com.lendingledger.ledger.LedgerService;
import com.lendingledger.policy.PolicyService;
import com.lendingledger.support.LendingFixtures;
import com.lendingledger.support.MutableClock;
import com.lendingledger.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the loan lifecycle: borrow, extend and return.
 *
 * The test profile uses a 14 day loan, a 10.00 USD deposit, no grace period,
 * 7 day extensions and at most 2 of them.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Import(TestClockConfig.class)
class LoanLedgerTest {

    private static final String BORROWER = "alice";
    private static final Money DEPOSIT = Money.of("10.00", Currency.USD);
    private static final Duration LOAN_DURATION = Duration.ofDays(14);

    @Autowired
    private LoanLedger loanLedger;

    @Autowired
    private EscrowVault escrowVault;

    @Autowired
    private FundsSink fundsSink;

    @Autowired
    private InventoryLedger inventoryLedger;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private PolicyService policyService;

    @Autowired
    private CatalogService catalogService;

    @Autowired
    private LendingFixtures fixtures;

    @Autowired
    private MutableClock clock;

    private Long itemId;
    private Instant start;

    @BeforeEach
    void setUp() {
        start = TestClockConfig.START;
        clock.setInstant(start);
        itemId = fixtures.itemWithUnits("The Dispossessed", 3);
        fixtures.member(BORROWER);
    }

    @Test
    void testBorrowOpensLoan() {
        assertEquals(Instant.EPOCH, loanLedger.loanDueDate(BORROWER, itemId));
        assertTrue(loanLedger.loanDeposit(BORROWER, itemId).isZero());
        Money treasuryBefore = fundsSink.getBalance();

        Instant dueDate = loanLedger.borrow(BORROWER, itemId, DEPOSIT);

        assertEquals(start.plus(LOAN_DURATION), dueDate);
        assertEquals(dueDate, loanLedger.loanDueDate(BORROWER, itemId));
        assertTrue(loanLedger.loanDeposit(BORROWER, itemId).isEqualTo(DEPOSIT));
        assertEquals(0, loanLedger.findLoan(BORROWER, itemId).orElseThrow().getExtensionsUsed());

        assertEquals(1, inventoryLedger.balanceOf(BORROWER, itemId));
        assertEquals(2, inventoryLedger.balanceOf(LendingFixtures.CUSTODIAN, itemId));
        assertTrue(escrowVault.heldFor(LoanKey.of(BORROWER, itemId)).orElseThrow().isEqualTo(DEPOSIT));
        assertTrue(fundsSink.getBalance().isEqualTo(treasuryBefore.add(DEPOSIT)));
    }

    @Test
    void testReturnAtDueDateIsOnTime() {
        Money treasuryBefore = fundsSink.getBalance();
        Money poolBefore = escrowVault.poolBalance();
        Instant dueDate = loanLedger.borrow(BORROWER, itemId, DEPOSIT);

        clock.setInstant(dueDate);
        boolean late = loanLedger.returnItem(BORROWER, itemId);

        assertFalse(late);
        assertEquals(Instant.EPOCH, loanLedger.loanDueDate(BORROWER, itemId));
        assertTrue(loanLedger.loanDeposit(BORROWER, itemId).isZero());
        assertTrue(loanLedger.findLoan(BORROWER, itemId).isEmpty());
        assertTrue(escrowVault.heldFor(LoanKey.of(BORROWER, itemId)).isEmpty());
        assertEquals(0, inventoryLedger.balanceOf(BORROWER, itemId));
        assertEquals(3, inventoryLedger.balanceOf(LendingFixtures.CUSTODIAN, itemId));
        assertTrue(fundsSink.getBalance().isEqualTo(treasuryBefore));
        assertTrue(escrowVault.poolBalance().isEqualTo(poolBefore));
    }

    @Test
    void testReturnOneSecondLateWithoutGraceForfeitsDeposit() {
        Money treasuryBefore = fundsSink.getBalance();
        Money poolBefore = escrowVault.poolBalance();
        Instant dueDate = loanLedger.borrow(BORROWER, itemId, DEPOSIT);

        clock.setInstant(dueDate.plusSeconds(1));
        boolean late = loanLedger.returnItem(BORROWER, itemId);

        assertTrue(late);
        assertEquals(Instant.EPOCH, loanLedger.loanDueDate(BORROWER, itemId));
        assertTrue(escrowVault.heldFor(LoanKey.of(BORROWER, itemId)).isEmpty());
        assertTrue(escrowVault.poolBalance().isEqualTo(poolBefore.add(DEPOSIT)));
        // no refund: the treasury keeps the deposit
        assertTrue(fundsSink.getBalance().isEqualTo(treasuryBefore.add(DEPOSIT)));
        assertEquals(3, inventoryLedger.balanceOf(LendingFixtures.CUSTODIAN, itemId));

        List<LedgerEntry> entries = ledgerService.getLoanLedger(LoanKey.of(BORROWER, itemId));
        assertTrue(containsEvent(entries, LedgerEventType.DEPOSIT_FORFEITED));
        assertTrue(containsEvent(entries, LedgerEventType.LOAN_RETURNED_LATE));
        assertFalse(containsEvent(entries, LedgerEventType.DEPOSIT_RELEASED));
    }

    @Test
    void testGracePeriodBoundary() {
        policyService.setGracePeriod(fixtures.steward(), Duration.ofDays(1));
        Long secondItem = fixtures.itemWithUnits("Kindred", 1);

        Instant dueDate = loanLedger.borrow(BORROWER, itemId, DEPOSIT);
        loanLedger.borrow(BORROWER, secondItem, DEPOSIT);

        clock.setInstant(dueDate.plus(Duration.ofDays(1)));
        assertFalse(loanLedger.returnItem(BORROWER, itemId));

        clock.setInstant(dueDate.plus(Duration.ofDays(1)).plusSeconds(1));
        assertTrue(loanLedger.returnItem(BORROWER, secondItem));
    }

    @Test
    void testExtendThenReturnAtNewDueDatePlusGraceRefundsInFull() {
        Duration grace = Duration.ofHours(6);
        policyService.setGracePeriod(fixtures.steward(), grace);
        Money treasuryBefore = fundsSink.getBalance();
        Instant dueDate = loanLedger.borrow(BORROWER, itemId, DEPOSIT);

        clock.setInstant(dueDate.minus(Duration.ofDays(1)));
        ExtensionResult result = loanLedger.requestExtension(BORROWER, itemId);

        Instant newDueDate = dueDate.plus(Duration.ofDays(7));
        assertEquals(newDueDate, result.getNewDueDate());
        assertEquals(1, result.getExtensionsUsed());
        assertEquals(newDueDate, loanLedger.loanDueDate(BORROWER, itemId));

        clock.setInstant(newDueDate.plus(grace));
        assertFalse(loanLedger.returnItem(BORROWER, itemId));
        assertTrue(fundsSink.getBalance().isEqualTo(treasuryBefore));
    }

    @Test
    void testExtensionAtDueDateIsAllowed() {
        Instant dueDate = loanLedger.borrow(BORROWER, itemId, DEPOSIT);

        clock.setInstant(dueDate);
        ExtensionResult result = loanLedger.requestExtension(BORROWER, itemId);

        assertEquals(dueDate.plus(Duration.ofDays(7)), result.getNewDueDate());
    }

    @Test
    void testExtensionAfterDueDateIsRejected() {
        Instant dueDate = loanLedger.borrow(BORROWER, itemId, DEPOSIT);

        clock.setInstant(dueDate.plusSeconds(1));
        StateConflictException e = assertThrows(StateConflictException.class,
            () -> loanLedger.requestExtension(BORROWER, itemId));

        assertEquals(LendingErrorCode.NO_ACTIVE_LOAN, e.getErrorCode());
        assertEquals(dueDate, loanLedger.loanDueDate(BORROWER, itemId));
    }

    @Test
    void testExtensionWithoutLoanIsRejected() {
        StateConflictException e = assertThrows(StateConflictException.class,
            () -> loanLedger.requestExtension(BORROWER, itemId));

        assertEquals(LendingErrorCode.NO_ACTIVE_LOAN, e.getErrorCode());
    }

    @Test
    void testExtensionBeyondMaximumIsRejected() {
        Instant dueDate = loanLedger.borrow(BORROWER, itemId, DEPOSIT);

        loanLedger.requestExtension(BORROWER, itemId);
        ExtensionResult second = loanLedger.requestExtension(BORROWER, itemId);
        assertEquals(2, second.getExtensionsUsed());
        assertEquals(dueDate.plus(Duration.ofDays(14)), second.getNewDueDate());

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> loanLedger.requestExtension(BORROWER, itemId));

        assertEquals(LendingErrorCode.MAX_EXTENSIONS_REACHED, e.getErrorCode());
        assertEquals(2, loanLedger.findLoan(BORROWER, itemId).orElseThrow().getExtensionsUsed());
    }

    @Test
    void testNoExtensionsWhenMaximumIsZero() {
        policyService.setMaxExtensions(fixtures.steward(), 0);
        loanLedger.borrow(BORROWER, itemId, DEPOSIT);

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> loanLedger.requestExtension(BORROWER, itemId));

        assertEquals(LendingErrorCode.MAX_EXTENSIONS_REACHED, e.getErrorCode());
    }

    @Test
    void testSecondReturnFailsWithNoSuchLoan() {
        loanLedger.borrow(BORROWER, itemId, DEPOSIT);
        loanLedger.returnItem(BORROWER, itemId);

        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
            () -> loanLedger.returnItem(BORROWER, itemId));

        assertEquals(LendingErrorCode.NO_SUCH_LOAN, e.getErrorCode());
    }

    @Test
    void testSurplusDepositIsRefundedInFull() {
        Money surplus = Money.of("25.00", Currency.USD);
        Money treasuryBefore = fundsSink.getBalance();

        loanLedger.borrow(BORROWER, itemId, surplus);
        assertTrue(loanLedger.loanDeposit(BORROWER, itemId).isEqualTo(surplus));
        assertTrue(fundsSink.getBalance().isEqualTo(treasuryBefore.add(surplus)));

        assertFalse(loanLedger.returnItem(BORROWER, itemId));

        assertTrue(fundsSink.getBalance().isEqualTo(treasuryBefore));
        LedgerEntry released = ledgerService.getLoanLedger(LoanKey.of(BORROWER, itemId)).stream()
            .filter(entry -> entry.getEventType() == LedgerEventType.DEPOSIT_RELEASED)
            .findFirst()
            .orElseThrow();
        assertTrue(released.getAmount().isEqualTo(surplus));
    }

    @Test
    void testDepositIsCapturedAtBorrowTime() {
        loanLedger.borrow(BORROWER, itemId, DEPOSIT);
        policyService.setDepositAmount(fixtures.steward(), Money.of("20.00", Currency.USD));

        assertTrue(loanLedger.loanDeposit(BORROWER, itemId).isEqualTo(DEPOSIT));

        Money treasuryBefore = fundsSink.getBalance();
        loanLedger.returnItem(BORROWER, itemId);
        assertTrue(fundsSink.getBalance().isEqualTo(treasuryBefore.subtract(DEPOSIT)));
    }

    @Test
    void testBorrowAgainAfterReturn() {
        loanLedger.borrow(BORROWER, itemId, DEPOSIT);
        loanLedger.returnItem(BORROWER, itemId);

        clock.advance(Duration.ofDays(1));
        Instant dueDate = loanLedger.borrow(BORROWER, itemId, DEPOSIT);

        assertEquals(start.plus(Duration.ofDays(1)).plus(LOAN_DURATION), dueDate);
        assertEquals(0, loanLedger.findLoan(BORROWER, itemId).orElseThrow().getExtensionsUsed());
    }

    @Test
    void testReturnAfterUnitMovedAwayFailsWithNotHolder() {
        loanLedger.borrow(BORROWER, itemId, DEPOSIT);
        inventoryLedger.transfer(BORROWER, "bob", itemId, 1);

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> loanLedger.returnItem(BORROWER, itemId));

        assertEquals(LendingErrorCode.NOT_HOLDER, e.getErrorCode());
        assertTrue(loanLedger.findLoan(BORROWER, itemId).isPresent());
    }

    @Test
    void testNonMemberIsRejectedFirst() {
        NotAuthorizedException e = assertThrows(NotAuthorizedException.class,
            () -> loanLedger.borrow("mallory", 999_999L, Money.of("1.00", Currency.USD)));

        assertEquals(LendingErrorCode.NOT_MEMBER, e.getErrorCode());
    }

    @Test
    void testUnknownItemIsRejected() {
        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
            () -> loanLedger.borrow(BORROWER, 999_999L, Money.of("1.00", Currency.USD)));

        assertEquals(LendingErrorCode.NO_SUCH_ITEM, e.getErrorCode());
    }

    @Test
    void testUnsetCustodianIsReportedBeforePausedItem() {
        catalogService.setPaused(fixtures.steward(), itemId, true);
        policyService.current().setCustodianId(null);

        LendingException e = assertThrows(LendingException.class,
            () -> loanLedger.borrow(BORROWER, itemId, DEPOSIT));

        assertEquals(LendingErrorCode.BRANCH_UNSET, e.getErrorCode());
    }

    @Test
    void testPausedItemIsReportedBeforeActiveLoan() {
        loanLedger.borrow(BORROWER, itemId, DEPOSIT);
        catalogService.setPaused(fixtures.steward(), itemId, true);

        LendingException e = assertThrows(LendingException.class,
            () -> loanLedger.borrow(BORROWER, itemId, Money.of("1.00", Currency.USD)));

        assertEquals(LendingErrorCode.ITEM_PAUSED, e.getErrorCode());
    }

    @Test
    void testActiveLoanIsReportedBeforeLowDeposit() {
        loanLedger.borrow(BORROWER, itemId, DEPOSIT);

        LendingException e = assertThrows(LendingException.class,
            () -> loanLedger.borrow(BORROWER, itemId, Money.of("1.00", Currency.USD)));

        assertEquals(LendingErrorCode.ACTIVE_LOAN_EXISTS, e.getErrorCode());
    }

    @Test
    void testLowDepositIsReportedBeforeUnavailable() {
        Long emptyItem = fixtures.itemWithUnits("Out of Print", 0);

        LendingException e = assertThrows(LendingException.class,
            () -> loanLedger.borrow(BORROWER, emptyItem, Money.of("9.99", Currency.USD)));

        assertEquals(LendingErrorCode.DEPOSIT_TOO_LOW, e.getErrorCode());
    }

    @Test
    void testDepositInOtherCurrencyIsTooLow() {
        LendingException e = assertThrows(LendingException.class,
            () -> loanLedger.borrow(BORROWER, itemId, Money.of("100.00", Currency.EUR)));

        assertEquals(LendingErrorCode.DEPOSIT_TOO_LOW, e.getErrorCode());
    }

    @Test
    void testNoUnitsLeftIsUnavailable() {
        Long singleItem = fixtures.itemWithUnits("Single Copy", 1);
        fixtures.member("bob");
        loanLedger.borrow("bob", singleItem, DEPOSIT);

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> loanLedger.borrow(BORROWER, singleItem, DEPOSIT));

        assertEquals(LendingErrorCode.UNAVAILABLE, e.getErrorCode());
        assertEquals(Instant.EPOCH, loanLedger.loanDueDate(BORROWER, singleItem));
    }

    @Test
    void testCustodianCannotBorrowFromItself() {
        fixtures.member(LendingFixtures.CUSTODIAN);

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> loanLedger.borrow(LendingFixtures.CUSTODIAN, itemId, DEPOSIT));

        assertEquals(LendingErrorCode.UNAVAILABLE, e.getErrorCode());
        assertEquals(3, inventoryLedger.balanceOf(LendingFixtures.CUSTODIAN, itemId));
    }

    @Test
    void testOpenLoanReturnsCommittedLoan() {
        Loan loan = loanLedger.openLoan(BORROWER, itemId, DEPOSIT);

        assertEquals(BORROWER, loan.getBorrowerId());
        assertEquals(itemId, loan.getItemId());
        assertEquals(LendingFixtures.CUSTODIAN, loan.getCustodianId());
        assertEquals(start, loan.getOpenedAt());
        assertEquals(start.plus(LOAN_DURATION), loan.getDueDate());
        assertTrue(loan.getDepositAmount().isEqualTo(DEPOSIT));
    }

    @Test
    void testRejectedBorrowChangesNothing() {
        Money treasuryBefore = fundsSink.getBalance();

        assertThrows(LendingException.class,
            () -> loanLedger.borrow(BORROWER, itemId, Money.of("5.00", Currency.USD)));

        assertTrue(loanLedger.findLoan(BORROWER, itemId).isEmpty());
        assertEquals(3, inventoryLedger.balanceOf(LendingFixtures.CUSTODIAN, itemId));
        assertTrue(escrowVault.heldFor(LoanKey.of(BORROWER, itemId)).isEmpty());
        assertTrue(fundsSink.getBalance().isEqualTo(treasuryBefore));
    }

    @Test
    void testLedgerRecordsLoanLifecycle() {
        loanLedger.borrow(BORROWER, itemId, DEPOSIT);
        loanLedger.requestExtension(BORROWER, itemId);
        loanLedger.returnItem(BORROWER, itemId);

        List<LedgerEntry> entries = ledgerService.getLoanLedger(LoanKey.of(BORROWER, itemId));
        assertEquals(5, entries.size());
        assertTrue(containsEvent(entries, LedgerEventType.LOAN_OPENED));
        assertTrue(containsEvent(entries, LedgerEventType.DEPOSIT_LOCKED));
        assertTrue(containsEvent(entries, LedgerEventType.LOAN_EXTENDED));
        assertTrue(containsEvent(entries, LedgerEventType.LOAN_RETURNED));
        assertTrue(containsEvent(entries, LedgerEventType.DEPOSIT_RELEASED));
    }

    @Test
    void testLoansOfAndOverdueLoans() {
        Long secondItem = fixtures.itemWithUnits("Parable of the Sower", 1);
        loanLedger.borrow(BORROWER, itemId, DEPOSIT);
        clock.advance(Duration.ofDays(2));
        loanLedger.borrow(BORROWER, secondItem, DEPOSIT);

        List<Loan> loans = loanLedger.loansOf(BORROWER);
        assertEquals(2, loans.size());
        assertEquals(itemId, loans.get(0).getItemId());

        clock.setInstant(start.plus(LOAN_DURATION).plusSeconds(1));
        List<Loan> overdue = loanLedger.overdueLoans().stream()
            .filter(loan -> loan.getBorrowerId().equals(BORROWER))
            .toList();
        assertEquals(1, overdue.size());
        assertEquals(itemId, overdue.get(0).getItemId());
    }

    private static boolean containsEvent(List<LedgerEntry> entries, LedgerEventType type) {
        return entries.stream().anyMatch(entry -> entry.getEventType() == type);
    }
}

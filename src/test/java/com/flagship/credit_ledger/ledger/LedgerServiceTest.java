package com.flagship.credit_ledger.ledger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the ledger invariants: duplicate postings, overdrafts,
 * concurrent debits and balance/event drift.
 */
@SpringBootTest
class LedgerServiceTest {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountService accountService;

    private UUID accountId;

    @BeforeEach
    void setUp() {
        accountId = accountService.getOrCreate("ledger-" + UUID.randomUUID()).getId();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Nested
    @DisplayName("Idempotent postings")
    class IdempotentPostings {

        @Test
        @DisplayName("Repeating a credit with the same reference records one event and one increment")
        void repeatedCreditIsRecordedOnce() {
            printTestHeader("Repeated Credit");

            LedgerEvent first = ledgerService.credit(accountId, Asset.FUNDS, new BigDecimal("50.00"),
                    LedgerEventKind.DEPOSIT_CREDIT, "tx-" + accountId);
            LedgerEvent second = ledgerService.credit(accountId, Asset.FUNDS, new BigDecimal("50.00"),
                    LedgerEventKind.DEPOSIT_CREDIT, "tx-" + accountId);

            printOutput("First event", first.getId());
            printOutput("Second event", second.getId());

            assertEquals(first.getId(), second.getId(), "Repeated credit should return the original event");
            assertEquals(0, ledgerService.balance(accountId, Asset.FUNDS).compareTo(new BigDecimal("50.00")));
            assertEquals(1, ledgerService.eventsForReference("tx-" + accountId).size());
            printSuccess("Credit applied exactly once");
        }

        @Test
        @DisplayName("A reference already used by another account is refused")
        void referenceOfAnotherAccountIsRefused() {
            UUID other = accountService.getOrCreate("ledger-other-" + UUID.randomUUID()).getId();
            String reference = "shared-" + UUID.randomUUID();
            ledgerService.credit(other, Asset.FUNDS, BigDecimal.TEN, LedgerEventKind.DEPOSIT_CREDIT, reference);

            assertThrows(IllegalStateException.class, () ->
                    ledgerService.credit(accountId, Asset.FUNDS, BigDecimal.TEN, LedgerEventKind.DEPOSIT_CREDIT, reference));
            assertEquals(0, ledgerService.balance(accountId, Asset.FUNDS).signum());
        }

        @Test
        @DisplayName("Credit and debit with the same reference are distinct operations")
        void kindIsPartOfTheKey() {
            String reference = "req-" + UUID.randomUUID();
            ledgerService.credit(accountId, Asset.CREDITS, new BigDecimal("5"), LedgerEventKind.PACKAGE_CREDIT, "seed-" + reference);
            ledgerService.debit(accountId, Asset.CREDITS, BigDecimal.ONE, LedgerEventKind.DEBIT, reference);
            ledgerService.credit(accountId, Asset.CREDITS, BigDecimal.ONE, LedgerEventKind.REFUND, reference);

            assertEquals(2, ledgerService.eventsForReference(reference).size());
            assertEquals(0, ledgerService.balance(accountId, Asset.CREDITS).compareTo(new BigDecimal("5")));
        }
    }

    @Nested
    @DisplayName("Balance invariants")
    class BalanceInvariants {

        @Test
        @DisplayName("A debit larger than the balance fails and changes nothing")
        void overdraftIsRejected() {
            printTestHeader("Overdraft");
            ledgerService.credit(accountId, Asset.FUNDS, new BigDecimal("10.00"), LedgerEventKind.DEPOSIT_CREDIT,
                    "seed-" + accountId);

            InsufficientFundsException e = assertThrows(InsufficientFundsException.class, () ->
                    ledgerService.debit(accountId, Asset.FUNDS, new BigDecimal("10.01"), LedgerEventKind.DEBIT,
                            "overdraft-" + accountId));

            printOutput("Available", e.getAvailable());
            assertEquals(0, e.getAvailable().compareTo(new BigDecimal("10.00")));
            assertEquals(0, ledgerService.balance(accountId, Asset.FUNDS).compareTo(new BigDecimal("10.00")));
            assertTrue(ledgerService.eventsForReference("overdraft-" + accountId).isEmpty());
            printSuccess("Overdraft rejected without side effects");
        }

        @Test
        @DisplayName("Balance equals the sum of event amounts after mixed operations")
        void balanceIsConserved() {
            ledgerService.credit(accountId, Asset.FUNDS, new BigDecimal("100.00"), LedgerEventKind.DEPOSIT_CREDIT, "c1-" + accountId);
            ledgerService.debit(accountId, Asset.FUNDS, new BigDecimal("30.00"), LedgerEventKind.DEBIT, "d1-" + accountId);
            ledgerService.credit(accountId, Asset.FUNDS, new BigDecimal("30.00"), LedgerEventKind.REFUND, "d1-" + accountId);
            ledgerService.debit(accountId, Asset.FUNDS, new BigDecimal("45.50"), LedgerEventKind.ADMIN_ADJUSTMENT, "a1-" + accountId);
            ledgerService.credit(accountId, Asset.CREDITS, new BigDecimal("20"), LedgerEventKind.VOUCHER_CREDIT, "v1-" + accountId);

            assertTrue(ledgerService.isConserved(accountId, Asset.FUNDS));
            assertTrue(ledgerService.isConserved(accountId, Asset.CREDITS));
            assertEquals(0, ledgerService.balance(accountId, Asset.FUNDS).compareTo(new BigDecimal("54.50")));

            List<LedgerEvent> history = ledgerService.history(accountId, 10);
            assertEquals(5, history.size());
            assertTrue(history.get(0).getSequenceNumber() > history.get(4).getSequenceNumber(),
                    "History should be newest first");
        }

        @Test
        @DisplayName("Debits on a suspended account fail, credits are still accepted")
        void suspendedAccountCannotBeDebited() {
            ledgerService.credit(accountId, Asset.FUNDS, new BigDecimal("20.00"), LedgerEventKind.DEPOSIT_CREDIT, "s1-" + accountId);
            accountService.suspend(accountId);

            assertThrows(AccountSuspendedException.class, () ->
                    ledgerService.debit(accountId, Asset.FUNDS, BigDecimal.ONE, LedgerEventKind.DEBIT, "s2-" + accountId));

            ledgerService.credit(accountId, Asset.FUNDS, new BigDecimal("5.00"), LedgerEventKind.DEPOSIT_CREDIT, "s3-" + accountId);
            assertEquals(0, ledgerService.balance(accountId, Asset.FUNDS).compareTo(new BigDecimal("25.00")));

            accountService.reactivate(accountId);
            ledgerService.debit(accountId, Asset.FUNDS, BigDecimal.ONE, LedgerEventKind.DEBIT, "s4-" + accountId);
            assertEquals(0, ledgerService.balance(accountId, Asset.FUNDS).compareTo(new BigDecimal("24.00")));
        }

        @Test
        @DisplayName("Non-positive amounts and missing references are rejected")
        void invalidArgumentsAreRejected() {
            assertThrows(IllegalArgumentException.class, () ->
                    ledgerService.credit(accountId, Asset.FUNDS, BigDecimal.ZERO, LedgerEventKind.DEPOSIT_CREDIT, "zero"));
            assertThrows(IllegalArgumentException.class, () ->
                    ledgerService.credit(accountId, Asset.FUNDS, BigDecimal.ONE, LedgerEventKind.DEPOSIT_CREDIT, " "));
            assertThrows(IllegalArgumentException.class, () ->
                    ledgerService.debit(accountId, Asset.FUNDS, BigDecimal.ONE, LedgerEventKind.REFUND, "wrong-kind"));
        }

        @Test
        @DisplayName("Amounts finer than the stored precision are refused instead of rounded")
        void amountsBeyondPrecisionAreRejected() {
            String reference = "precise-" + accountId;

            assertThrows(IllegalArgumentException.class, () ->
                    ledgerService.credit(accountId, Asset.FUNDS, new BigDecimal("10.123456"), LedgerEventKind.DEPOSIT_CREDIT, reference));
            assertTrue(ledgerService.findEvent(LedgerEventKind.DEPOSIT_CREDIT, reference).isEmpty());

            LedgerEvent event = ledgerService.credit(accountId, Asset.FUNDS, new BigDecimal("10.123400"),
                    LedgerEventKind.DEPOSIT_CREDIT, reference);
            LedgerEvent stored = ledgerService.findEvent(LedgerEventKind.DEPOSIT_CREDIT, reference).orElseThrow();

            assertEquals(new BigDecimal("10.1234"), event.getAmount());
            assertEquals(stored.getAmount(), event.getAmount());
            assertEquals(stored.getResultingBalance(), event.getResultingBalance());
        }
    }

    @Test
    @DisplayName("Concurrent debits never overdraw the account")
    void concurrentDebitsNeverOverdraw() throws InterruptedException {
        printTestHeader("Concurrent Debits");
        ledgerService.credit(accountId, Asset.FUNDS, new BigDecimal("100.00"), LedgerEventKind.DEPOSIT_CREDIT,
                "seed-concurrent-" + accountId);

        int threadCount = 20;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger insufficientCount = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            String reference = "debit-" + i + "-" + accountId;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    ledgerService.debit(accountId, Asset.FUNDS, new BigDecimal("10.00"), LedgerEventKind.DEBIT, reference);
                    successCount.incrementAndGet();
                } catch (InsufficientFundsException e) {
                    insufficientCount.incrementAndGet();
                } catch (Exception e) {
                    System.out.println("Unexpected failure: " + e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Successful debits", successCount.get());
        printOutput("Insufficient funds", insufficientCount.get());

        assertEquals(10, successCount.get(), "Exactly ten debits of 10 fit into 100");
        assertEquals(10, insufficientCount.get());
        assertEquals(0, ledgerService.balance(accountId, Asset.FUNDS).signum());
        assertTrue(ledgerService.isConserved(accountId, Asset.FUNDS));
        printSuccess("Balance reached zero and never went negative");
    }
}

package com.flagship.otp_rental.ledger;

import com.flagship.otp_rental.exception.InsufficientBalanceException;
import com.flagship.otp_rental.support.TestClockConfig;
import com.flagship.otp_rental.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the balance ledger: overdrafts, duplicate refunds,
 * concurrent debits, and balances drifting away from their entries.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class BalanceLedgerServiceTest {

    @Autowired
    private BalanceLedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Long userId;

    @BeforeEach
    void setUp() {
        TestData.clearTables(jdbcTemplate);
        userId = TestData.randomUserId();
    }

    @Nested
    @DisplayName("Debits")
    class DebitTests {

        @Test
        @DisplayName("Debit within balance reduces it and appends a negative entry")
        void debitWithinBalance() {
            // Given
            ledgerService.credit(userId, new BigDecimal("5000"), LedgerReason.TOPUP, null, "top-up");
            UUID sessionId = UUID.randomUUID();

            // When
            BigDecimal after = ledgerService.debit(userId, new BigDecimal("1200"), LedgerReason.RENTAL_DEBIT,
                    sessionId, "tiktok rental");

            // Then
            assertEquals(0, new BigDecimal("3800").compareTo(after));
            assertEquals(0, new BigDecimal("3800").compareTo(ledgerService.getBalance(userId)));

            LedgerEntry entry = ledgerService.findEntry(sessionId, LedgerReason.RENTAL_DEBIT).orElseThrow();
            assertEquals(0, new BigDecimal("-1200").compareTo(entry.getAmount()));
            assertEquals(0, new BigDecimal("3800").compareTo(entry.getBalanceAfter()));
            assertTrue(entry.isDebit());
        }

        @Test
        @DisplayName("Debit larger than the balance is rejected and writes nothing")
        void debitBeyondBalanceRejected() {
            ledgerService.credit(userId, new BigDecimal("1000"), LedgerReason.TOPUP, null, "top-up");
            long entriesBefore = ledgerService.countEntries(userId);

            InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class, () ->
                    ledgerService.debit(userId, new BigDecimal("1200"), LedgerReason.RENTAL_DEBIT,
                            UUID.randomUUID(), "tiktok rental"));

            assertEquals(0, new BigDecimal("1200").compareTo(e.getRequired()));
            assertEquals(0, new BigDecimal("1000").compareTo(e.getAvailable()));
            assertEquals(0, new BigDecimal("1000").compareTo(ledgerService.getBalance(userId)));
            assertEquals(entriesBefore, ledgerService.countEntries(userId));
        }

        @Test
        @DisplayName("Debit for a user who never had a balance is rejected")
        void debitUnknownUserRejected() {
            assertThrows(InsufficientBalanceException.class, () ->
                    ledgerService.debit(userId, BigDecimal.ONE, LedgerReason.RENTAL_DEBIT, UUID.randomUUID(), "x"));
            assertEquals(0, BigDecimal.ZERO.compareTo(ledgerService.getBalance(userId)));
        }

        @Test
        @DisplayName("Debit exactly equal to the balance leaves zero")
        void debitExactBalance() {
            ledgerService.credit(userId, new BigDecimal("2100"), LedgerReason.TOPUP, null, "top-up");

            BigDecimal after = ledgerService.debit(userId, new BigDecimal("2100"), LedgerReason.RENTAL_DEBIT,
                    UUID.randomUUID(), "rental");

            assertEquals(0, BigDecimal.ZERO.compareTo(after));
        }

        @Test
        @DisplayName("Non-positive amounts are refused")
        void nonPositiveAmountRefused() {
            assertThrows(IllegalArgumentException.class, () ->
                    ledgerService.debit(userId, BigDecimal.ZERO, LedgerReason.RENTAL_DEBIT, UUID.randomUUID(), "x"));
            assertThrows(IllegalArgumentException.class, () ->
                    ledgerService.credit(userId, new BigDecimal("-5"), LedgerReason.TOPUP, null, "x"));
        }

        @Test
        @DisplayName("Concurrent debits never overdraw the balance")
        void concurrentDebitsNeverOverdraw() throws Exception {
            // Given: room for exactly four rentals
            ledgerService.credit(userId, new BigDecimal("4800"), LedgerReason.TOPUP, null, "top-up");
            int attempts = 10;
            ExecutorService executor = Executors.newFixedThreadPool(attempts);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();

            // When
            for (int i = 0; i < attempts; i++) {
                Callable<Boolean> debit = () -> {
                    start.await();
                    try {
                        ledgerService.debit(userId, new BigDecimal("1200"), LedgerReason.RENTAL_DEBIT,
                                UUID.randomUUID(), "rental");
                        return true;
                    } catch (InsufficientBalanceException e) {
                        return false;
                    }
                };
                results.add(executor.submit(debit));
            }
            start.countDown();

            int succeeded = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    succeeded++;
                }
            }
            executor.shutdown();

            // Then
            assertEquals(4, succeeded);
            assertEquals(0, BigDecimal.ZERO.compareTo(ledgerService.getBalance(userId)));
            assertEquals(0, ledgerService.getBalance(userId).compareTo(ledgerService.sumOfEntries(userId)));
        }
    }

    @Nested
    @DisplayName("Credits and refunds")
    class CreditTests {

        @Test
        @DisplayName("First credit opens the balance")
        void firstCreditOpensBalance() {
            BigDecimal after = ledgerService.credit(userId, new BigDecimal("5000"), LedgerReason.TOPUP, null, "top-up");

            assertEquals(0, new BigDecimal("5000").compareTo(after));
            assertEquals(1, ledgerService.countEntries(userId));
        }

        @Test
        @DisplayName("A second refund for the same session is rejected by the database")
        void duplicateRefundRejected() {
            ledgerService.credit(userId, new BigDecimal("5000"), LedgerReason.TOPUP, null, "top-up");
            UUID sessionId = UUID.randomUUID();
            ledgerService.debit(userId, new BigDecimal("1200"), LedgerReason.RENTAL_DEBIT, sessionId, "rental");
            ledgerService.credit(userId, new BigDecimal("1200"), LedgerReason.RENTAL_REFUND, sessionId, "refund");

            assertThrows(DataIntegrityViolationException.class, () ->
                    ledgerService.credit(userId, new BigDecimal("1200"), LedgerReason.RENTAL_REFUND, sessionId, "refund"));

            // The failed credit rolled back with its entry
            assertEquals(0, new BigDecimal("5000").compareTo(ledgerService.getBalance(userId)));
            assertEquals(2, ledgerService.findEntriesForSession(sessionId).size());
        }

        @Test
        @DisplayName("Sum of entries always equals the stored balance")
        void balanceEqualsSumOfEntries() {
            ledgerService.credit(userId, new BigDecimal("5000"), LedgerReason.TOPUP, null, "top-up");
            UUID first = UUID.randomUUID();
            UUID second = UUID.randomUUID();
            ledgerService.debit(userId, new BigDecimal("2100"), LedgerReason.RENTAL_DEBIT, first, "rental");
            ledgerService.debit(userId, new BigDecimal("1200"), LedgerReason.RENTAL_DEBIT, second, "rental");
            ledgerService.credit(userId, new BigDecimal("2100"), LedgerReason.RENTAL_REFUND, first, "refund");

            assertEquals(0, new BigDecimal("3800").compareTo(ledgerService.getBalance(userId)));
            assertEquals(0, ledgerService.getBalance(userId).compareTo(ledgerService.sumOfEntries(userId)));
        }
    }

    @Nested
    @DisplayName("Manual adjustments and listing")
    class AdjustmentTests {

        @Test
        @DisplayName("Negative adjustment debits, positive credits")
        void signedAdjustments() {
            ledgerService.adjust(userId, new BigDecimal("3000"), LedgerReason.TOPUP, "bank transfer");
            BigDecimal after = ledgerService.adjust(userId, new BigDecimal("-500"), LedgerReason.ADMIN_ADJUST, "correction");

            assertEquals(0, new BigDecimal("2500").compareTo(after));
        }

        @Test
        @DisplayName("Rental reasons cannot be used for manual adjustments")
        void rentalReasonRefused() {
            assertThrows(IllegalArgumentException.class, () ->
                    ledgerService.adjust(userId, new BigDecimal("1200"), LedgerReason.RENTAL_REFUND, "sneaky"));
            assertThrows(IllegalArgumentException.class, () ->
                    ledgerService.adjust(userId, BigDecimal.ZERO, LedgerReason.ADMIN_ADJUST, "nothing"));
        }

        @Test
        @DisplayName("Entries are listed newest first and paged")
        void entriesNewestFirst() {
            ledgerService.credit(userId, new BigDecimal("100"), LedgerReason.TOPUP, null, "first");
            ledgerService.credit(userId, new BigDecimal("200"), LedgerReason.TOPUP, null, "second");
            ledgerService.credit(userId, new BigDecimal("300"), LedgerReason.TOPUP, null, "third");

            List<LedgerEntry> firstPage = ledgerService.findEntries(userId, 0, 2);
            List<LedgerEntry> secondPage = ledgerService.findEntries(userId, 1, 2);

            assertEquals(2, firstPage.size());
            assertEquals("third", firstPage.get(0).getDescription());
            assertEquals("second", firstPage.get(1).getDescription());
            assertEquals(1, secondPage.size());
            assertEquals("first", secondPage.get(0).getDescription());
            assertEquals(3, ledgerService.countEntries(userId));
        }
    }
}

package com.flagship.gift_card_ledger.giftcard;

import com.flagship.gift_card_ledger.exception.InsufficientBalanceException;
import com.flagship.gift_card_ledger.exception.InvalidOperationException;
import com.flagship.gift_card_ledger.exception.NotFoundException;
import com.flagship.gift_card_ledger.exception.ValidationException;
import com.flagship.gift_card_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Try to break the gift card ledger.
 *
 * These tests attempt to violate the balance invariants:
 * - Overdrawing a card
 * - Operating a card that is no longer ACTIVE
 * - Breaking or rewriting the transaction chain
 * - Concurrent balance changes on one card
 */
class LedgerStoreTest extends IntegrationTestSupport {

    @Autowired
    private LedgerStore ledgerStore;

    private UUID franchiseId;
    private UUID establishmentId;

    @BeforeEach
    void setUp() {
        franchiseId = createFranchise("10.00");
        establishmentId = createEstablishment(franchiseId);
    }

    private GiftCard newCard(String initialValue) {
        return ledgerStore.createGiftCard(franchiseId, establishmentId, new BigDecimal(initialValue), null);
    }

    private BalanceChange apply(GiftCard card, String delta, TransactionType type) {
        return ledgerStore.applyBalanceChange(BalanceChangeCommand.builder()
            .giftCardId(card.getId())
            .establishmentId(establishmentId)
            .delta(new BigDecimal(delta))
            .type(type)
            .description("test " + type)
            .metadata(Map.of(GiftCardTransaction.METADATA_ACTOR, "ledger-test"))
            .build());
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }

    @Test
    @DisplayName("New card is ACTIVE with balance equal to its initial value")
    void testCreateGiftCard() {
        printTestHeader("Create Gift Card");

        // Given/When: A card created with 100.00
        GiftCard card = newCard("100.00");
        printOutput("Gift Card", card);

        // Then
        assertEquals(0, card.getCurrentBalance().compareTo(new BigDecimal("100.00")));
        assertEquals(GiftCardStatus.ACTIVE, card.getStatus());
        assertTrue(GiftCardCodeGenerator.isWellFormed(card.getCode()), "Code should be well formed: " + card.getCode());

        GiftCard stored = ledgerStore.findByCode(card.getCode()).orElseThrow();
        assertEquals(card.getId(), stored.getId());
        assertEquals(0, stored.getInitialValue().compareTo(new BigDecimal("100.00")));
        assertTrue(ledgerStore.findTransactions(card.getId()).isEmpty(), "Creation writes no transaction");
        printSuccess("Card created ACTIVE with full balance");
    }

    @Test
    @DisplayName("Creation rejects establishments of another franchise and past validity")
    void testCreateGiftCard_InvalidInput() {
        printTestHeader("Create Gift Card - Invalid Input");

        UUID otherFranchise = createFranchise("5.00");
        printExpectedException("ValidationException", "Establishment does not belong to the franchise");
        assertThrows(ValidationException.class, () ->
            ledgerStore.createGiftCard(otherFranchise, establishmentId, new BigDecimal("10.00"), null));

        printExpectedException("ValidationException", "Validity date must be in the future");
        assertThrows(ValidationException.class, () ->
            ledgerStore.createGiftCard(franchiseId, establishmentId, new BigDecimal("10.00"),
                Instant.now().minus(1, ChronoUnit.DAYS)));

        printExpectedException("NotFoundException", "Unknown establishment");
        assertThrows(NotFoundException.class, () ->
            ledgerStore.createGiftCard(franchiseId, UUID.randomUUID(), new BigDecimal("10.00"), null));
        printSuccess("Invalid creations rejected");
    }

    @Test
    @DisplayName("Recharge above the initial value is allowed and recorded with before/after")
    void testRecharge() {
        printTestHeader("Recharge 50 on a card of 100");

        GiftCard card = newCard("100.00");

        BalanceChange change = apply(card, "50.00", TransactionType.RECHARGE);
        printOutput("Transaction", change.getTransaction());

        assertEquals(0, change.getGiftCard().getCurrentBalance().compareTo(new BigDecimal("150.00")));
        GiftCardTransaction tx = change.getTransaction();
        assertEquals(TransactionType.RECHARGE, tx.getType());
        assertEquals(0, tx.getAmount().compareTo(new BigDecimal("50.00")));
        assertEquals(0, tx.getBalanceBefore().compareTo(new BigDecimal("100.00")));
        assertEquals(0, tx.getBalanceAfter().compareTo(new BigDecimal("150.00")));
        assertEquals("ledger-test", tx.getMetadata().get(GiftCardTransaction.METADATA_ACTOR));
        printSuccess("Recharge applied");
    }

    @Test
    @DisplayName("Using the full balance moves the card to USED; a further usage reports the shortfall")
    void testUseFullBalance() {
        printTestHeader("Use full balance then 0.01 more");

        GiftCard card = newCard("100.00");
        apply(card, "50.00", TransactionType.RECHARGE);

        BalanceChange change = apply(card, "-150.00", TransactionType.USAGE);
        printOutput("Card after usage", change.getGiftCard());
        assertEquals(0, change.getGiftCard().getCurrentBalance().signum());
        assertEquals(GiftCardStatus.USED, change.getGiftCard().getStatus());

        printExpectedException("InsufficientBalanceException", "available=0, requested=0.01");
        InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
            () -> apply(card, "-0.01", TransactionType.USAGE));
        assertEquals(0, e.getAvailable().signum());
        assertEquals(0, e.getRequested().compareTo(new BigDecimal("0.01")));
        printSuccess("Shortfall reported with available and requested amounts");
    }

    @Test
    @DisplayName("Overdraw is rejected and leaves balance and history untouched")
    void testOverdraw_ShouldFail() {
        printTestHeader("Use 200 from a card holding 150");

        GiftCard card = newCard("100.00");
        apply(card, "50.00", TransactionType.RECHARGE);

        printExpectedException("InsufficientBalanceException", "available=150.00, requested=200.00");
        assertThrows(InsufficientBalanceException.class, () -> apply(card, "-200.00", TransactionType.USAGE));

        GiftCard stored = ledgerStore.findById(card.getId()).orElseThrow();
        assertEquals(0, stored.getCurrentBalance().compareTo(new BigDecimal("150.00")));
        assertEquals(GiftCardStatus.ACTIVE, stored.getStatus());
        assertEquals(1, ledgerStore.findTransactions(card.getId()).size(), "No transaction written for the rejection");
        printSuccess("Rejected usage had no effect");
    }

    @Test
    @DisplayName("Cancelled, expired and foreign-establishment operations are invalid")
    void testInoperableCards() {
        printTestHeader("Inoperable cards");

        GiftCard cancelled = newCard("20.00");
        ledgerStore.cancel(cancelled.getId());
        printExpectedException("InvalidOperationException", "Card is CANCELLED");
        assertThrows(InvalidOperationException.class, () -> apply(cancelled, "5.00", TransactionType.RECHARGE));

        GiftCard expiring = ledgerStore.createGiftCard(franchiseId, establishmentId, new BigDecimal("20.00"),
            Instant.now().plus(1, ChronoUnit.HOURS));
        jdbcTemplate.update("UPDATE gift_cards SET valid_until = ? WHERE id = ?",
            java.sql.Timestamp.from(Instant.now().minus(1, ChronoUnit.MINUTES)), expiring.getId());
        printExpectedException("InvalidOperationException", "Validity has passed");
        assertThrows(InvalidOperationException.class, () -> apply(expiring, "-5.00", TransactionType.USAGE));

        GiftCard card = newCard("20.00");
        UUID otherEstablishment = createEstablishment(franchiseId);
        printExpectedException("InvalidOperationException", "Card belongs to another establishment");
        assertThrows(InvalidOperationException.class, () -> ledgerStore.applyBalanceChange(
            BalanceChangeCommand.builder()
                .giftCardId(card.getId())
                .establishmentId(otherEstablishment)
                .delta(new BigDecimal("-5.00"))
                .type(TransactionType.USAGE)
                .build()));
        printSuccess("All inoperable cases rejected");
    }

    @Test
    @DisplayName("Refund may not lift the balance above the initial value")
    void testRefundCappedAtInitialValue() {
        printTestHeader("Refund above initial value");

        GiftCard card = newCard("50.00");
        apply(card, "-10.00", TransactionType.USAGE);

        BalanceChange refund = apply(card, "10.00", TransactionType.REFUND);
        assertEquals(0, refund.getGiftCard().getCurrentBalance().compareTo(new BigDecimal("50.00")));

        printExpectedException("InvalidOperationException", "Balance would exceed the card's initial value");
        assertThrows(InvalidOperationException.class, () -> apply(card, "0.01", TransactionType.REFUND));
        printSuccess("Refund cap enforced");
    }

    @Test
    @DisplayName("Delta sign must match the transaction type")
    void testDeltaSignMismatch_ShouldFail() {
        printTestHeader("Delta sign mismatch");

        GiftCard card = newCard("50.00");
        assertThrows(ValidationException.class, () -> apply(card, "-5.00", TransactionType.RECHARGE));
        assertThrows(ValidationException.class, () -> apply(card, "5.00", TransactionType.USAGE));
        printSuccess("Mismatched signs rejected");
    }

    @Test
    @DisplayName("Transaction chain is continuous and ends at the card's balance")
    void testTransactionChain() {
        printTestHeader("Transaction chain continuity");

        GiftCard card = newCard("100.00");
        apply(card, "25.00", TransactionType.RECHARGE);
        apply(card, "-40.00", TransactionType.USAGE);
        apply(card, "10.00", TransactionType.RECHARGE);
        apply(card, "-95.00", TransactionType.USAGE);

        List<GiftCardTransaction> chain = ledgerStore.findTransactions(card.getId());
        chain.forEach(tx -> printOutput("Tx #" + tx.getSequenceNumber(),
            tx.getType() + " " + tx.getBalanceBefore() + " -> " + tx.getBalanceAfter()));

        assertEquals(4, chain.size());
        assertEquals(0, chain.get(0).getBalanceBefore().compareTo(new BigDecimal("100.00")));
        for (int i = 0; i < chain.size() - 1; i++) {
            assertEquals(0, chain.get(i).getBalanceAfter().compareTo(chain.get(i + 1).getBalanceBefore()),
                "Chain broken between #" + i + " and #" + (i + 1));
        }
        GiftCard stored = ledgerStore.findById(card.getId()).orElseThrow();
        assertEquals(0, chain.get(chain.size() - 1).getBalanceAfter().compareTo(stored.getCurrentBalance()));
        assertEquals(GiftCardStatus.USED, stored.getStatus());
        printSuccess("Chain verified");
    }

    @Test
    @DisplayName("Database trigger rejects a transaction that does not continue the chain")
    void testChainTrigger_DatabaseEnforcement() {
        printTestHeader("Chain trigger - Database Level Enforcement");

        GiftCard card = newCard("100.00");
        printExpectedException("Database Constraint Violation", "Transaction chain broken");

        Exception exception = assertThrows(Exception.class, () -> jdbcTemplate.update(
            "INSERT INTO gift_card_transactions (id, gift_card_id, establishment_id, type, amount, " +
            "balance_before, balance_after) VALUES (?, ?, ?, 'USAGE', 10.00, 90.00, 80.00)",
            UUID.randomUUID(), card.getId(), establishmentId));

        String message = rootMessage(exception);
        printOutput("Error", message);
        assertTrue(message != null && message.contains("chain broken"), "Unexpected error: " + message);
        printSuccess("Trigger rejected the broken chain");
    }

    @Test
    @DisplayName("Transactions are append-only")
    void testAppendOnly_DatabaseEnforcement() {
        printTestHeader("Append-only transactions");

        GiftCard card = newCard("100.00");
        GiftCardTransaction tx = apply(card, "-10.00", TransactionType.USAGE).getTransaction();

        Exception update = assertThrows(Exception.class, () -> jdbcTemplate.update(
            "UPDATE gift_card_transactions SET description = 'rewritten' WHERE id = ?", tx.getId()));
        assertTrue(rootMessage(update).contains("append-only"));

        Exception delete = assertThrows(Exception.class, () -> jdbcTemplate.update(
            "DELETE FROM gift_card_transactions WHERE id = ?", tx.getId()));
        assertTrue(rootMessage(delete).contains("append-only"));
        printSuccess("UPDATE and DELETE rejected");
    }

    @Test
    @DisplayName("Concurrent recharges serialize: both land and the pairs chain")
    void testConcurrentRecharges() throws InterruptedException {
        printTestHeader("Two concurrent recharges of 10");

        GiftCard card = newCard("50.00");
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(2);
        AtomicInteger failures = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(2);

        for (int i = 0; i < 2; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    apply(card, "10.00", TransactionType.RECHARGE);
                } catch (Exception e) {
                    failures.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        GiftCard stored = ledgerStore.findById(card.getId()).orElseThrow();
        List<GiftCardTransaction> chain = ledgerStore.findTransactions(card.getId());
        printOutput("Final balance", stored.getCurrentBalance());
        printOutput("Transactions", chain.size());

        assertEquals(0, failures.get());
        assertEquals(0, stored.getCurrentBalance().compareTo(new BigDecimal("70.00")));
        assertEquals(2, chain.size());
        assertEquals(0, chain.get(0).getBalanceBefore().compareTo(new BigDecimal("50.00")));
        assertEquals(0, chain.get(0).getBalanceAfter().compareTo(chain.get(1).getBalanceBefore()));
        assertEquals(0, chain.get(1).getBalanceAfter().compareTo(new BigDecimal("70.00")));
        printSuccess("No lost update");
    }

    @Test
    @DisplayName("Concurrent usages never overdraw and accepted deltas sum to the balance change")
    void testConcurrentUsages() throws InterruptedException {
        printTestHeader("Twenty concurrent usages of 10 against 100");

        GiftCard card = newCard("100.00");
        int threads = 20;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threads);
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    apply(card, "-10.00", TransactionType.USAGE);
                    accepted.incrementAndGet();
                } catch (InsufficientBalanceException e) {
                    rejected.incrementAndGet();
                } catch (Exception e) {
                    System.out.println("Unexpected: " + e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        GiftCard stored = ledgerStore.findById(card.getId()).orElseThrow();
        List<GiftCardTransaction> chain = ledgerStore.findTransactions(card.getId());
        printOutput("Accepted", accepted.get());
        printOutput("Rejected", rejected.get());
        printOutput("Final balance", stored.getCurrentBalance());

        assertEquals(10, accepted.get());
        assertEquals(10, rejected.get());
        assertEquals(0, stored.getCurrentBalance().signum());
        assertEquals(GiftCardStatus.USED, stored.getStatus());
        assertEquals(10, chain.size());

        BigDecimal deltaSum = chain.stream()
            .map(tx -> tx.getBalanceAfter().subtract(tx.getBalanceBefore()))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, deltaSum.compareTo(stored.getCurrentBalance().subtract(stored.getInitialValue())));
        for (int i = 0; i < chain.size() - 1; i++) {
            assertEquals(0, chain.get(i).getBalanceAfter().compareTo(chain.get(i + 1).getBalanceBefore()));
        }

        // Creation time follows lock order, not the order the transactions started in
        List<GiftCardTransaction> byCreatedAt = new ArrayList<>(chain);
        byCreatedAt.sort(Comparator.comparing(GiftCardTransaction::getCreatedAt)
            .thenComparing(GiftCardTransaction::getSequenceNumber));
        for (int i = 0; i < byCreatedAt.size() - 1; i++) {
            assertEquals(0, byCreatedAt.get(i).getBalanceAfter().compareTo(byCreatedAt.get(i + 1).getBalanceBefore()),
                "Chain broken at creation-time position " + i);
        }
        printSuccess("Serializable order, no overdraw");
    }

    @Test
    @DisplayName("expireOverdue moves only ACTIVE cards past their validity")
    void testExpireOverdue() {
        printTestHeader("Expire overdue cards");

        GiftCard overdue = ledgerStore.createGiftCard(franchiseId, establishmentId, new BigDecimal("20.00"),
            Instant.now().plus(1, ChronoUnit.HOURS));
        GiftCard current = ledgerStore.createGiftCard(franchiseId, establishmentId, new BigDecimal("20.00"),
            Instant.now().plus(2, ChronoUnit.DAYS));

        int expired = ledgerStore.expireOverdue(Instant.now().plus(3, ChronoUnit.HOURS));
        printOutput("Expired count", expired);

        assertTrue(expired >= 1);
        assertEquals(GiftCardStatus.EXPIRED, ledgerStore.findById(overdue.getId()).orElseThrow().getStatus());
        assertEquals(GiftCardStatus.ACTIVE, ledgerStore.findById(current.getId()).orElseThrow().getStatus());
        printSuccess("Only the overdue card expired");
    }
}

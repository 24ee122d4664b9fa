package com.flagship.gift_card_ledger.giftcard;

import com.flagship.gift_card_ledger.commission.Commission;
import com.flagship.gift_card_ledger.commission.CommissionStatus;
import com.flagship.gift_card_ledger.exception.ConflictException;
import com.flagship.gift_card_ledger.exception.InvalidOperationException;
import com.flagship.gift_card_ledger.exception.NotFoundException;
import com.flagship.gift_card_ledger.exception.ValidationException;
import com.flagship.gift_card_ledger.job.JobKind;
import com.flagship.gift_card_ledger.outbox.OutboxEvent;
import com.flagship.gift_card_ledger.outbox.OutboxService;
import com.flagship.gift_card_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Gift card operations end to end against the database: issuing, recharge
 * with commission derivation, usage, replay by idempotency key, inquiry.
 */
class GiftCardEngineTest extends IntegrationTestSupport {

    @Autowired
    private GiftCardEngine engine;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private OutboxService outboxService;

    private UUID franchiseId;
    private UUID establishmentId;

    @BeforeEach
    void setUp() {
        franchiseId = createFranchise("10.00");
        establishmentId = createEstablishment(franchiseId);
    }

    private OperationContext ctx() {
        return new OperationContext("cashier-1", establishmentId, null, "corr-" + UUID.randomUUID());
    }

    private OperationContext ctx(String idempotencyKey) {
        return new OperationContext("cashier-1", establishmentId, idempotencyKey, null);
    }

    private GiftCard issue(String value) {
        return engine.create(ctx(), franchiseId, new BigDecimal(value), null).getGiftCard();
    }

    @Test
    @DisplayName("Issued card carries a PNG QR code")
    void testCreateWithQrCode() {
        printTestHeader("Create gift card with QR code");

        IssuedGiftCard issued = engine.create(ctx(), franchiseId, new BigDecimal("100.00"), null);
        printOutput("Code", issued.getGiftCard().getCode());

        assertEquals(GiftCardStatus.ACTIVE, issued.getGiftCard().getStatus());
        assertEquals(0, issued.getGiftCard().getCurrentBalance().compareTo(new BigDecimal("100.00")));
        assertTrue(issued.getQrCode().startsWith(GiftCardQrCodeRenderer.DATA_URI_PREFIX));
        printSuccess("Card issued");
    }

    @Test
    @DisplayName("Recharge creates a PENDING commission of amount * rate / 100 and queues its charge")
    void testRechargeDerivesCommission() {
        printTestHeader("Recharge derives commission");

        // Given: a card of 100 under a 10% franchise
        GiftCard card = issue("100.00");

        // When: recharging 50
        RechargeResult result = engine.recharge(ctx(), GiftCardReference.byId(card.getId()),
            new BigDecimal("50.00"), "top-up");
        printOutput("Transaction", result.getTransaction());
        printOutput("Commission", result.getCommission());

        // Then
        assertFalse(result.isReplayed());
        assertEquals(0, result.getGiftCard().getCurrentBalance().compareTo(new BigDecimal("150.00")));
        assertEquals(0, result.getTransaction().getBalanceBefore().compareTo(new BigDecimal("100.00")));
        assertEquals(0, result.getTransaction().getBalanceAfter().compareTo(new BigDecimal("150.00")));
        assertEquals(0, result.getTransaction().commissionRateSnapshot().compareTo(new BigDecimal("10.00")));

        Commission commission = result.getCommission();
        assertNotNull(commission);
        assertEquals(CommissionStatus.PENDING, commission.getStatus());
        assertEquals(0, commission.getAmount().compareTo(new BigDecimal("5.00")));
        assertEquals(result.getTransaction().getId(), commission.getTransactionId());
        assertEquals(franchiseId, commission.getFranchiseId());
        assertEquals(establishmentId, commission.getEstablishmentId());
        assertNull(commission.getGatewayChargeId(), "No gateway interaction yet");

        List<OutboxEvent> jobs = outboxService.getEventsForAggregate(
            JobKind.COMMISSION_CHARGE.getAggregateType(), commission.getId());
        printOutput("Queued jobs", jobs.size());
        assertEquals(1, jobs.size());
        assertTrue(jobs.get(0).getPayload().contains(commission.getId().toString()));
        printSuccess("Commission derived and charge queued");
    }

    @Test
    @DisplayName("Commission amount is rounded half-up to cents")
    void testCommissionRounding() {
        printTestHeader("Commission rounding");

        UUID oddFranchise = createFranchise("2.50");
        UUID oddEstablishment = createEstablishment(oddFranchise);
        OperationContext oddCtx = new OperationContext("cashier-2", oddEstablishment, null, null);
        GiftCard card = engine.create(oddCtx, oddFranchise, new BigDecimal("10.00"), null).getGiftCard();

        RechargeResult result = engine.recharge(oddCtx, GiftCardReference.byCode(card.getCode()),
            new BigDecimal("33.33"), null);
        printOutput("Commission amount", result.getCommission().getAmount());

        // 33.33 * 2.5 / 100 = 0.833250
        assertEquals(0, result.getCommission().getAmount().compareTo(new BigDecimal("0.83")));
        printSuccess("Rounded to 0.83");
    }

    @Test
    @DisplayName("Repeating a recharge with the same idempotency key returns the original")
    void testRechargeReplay() {
        printTestHeader("Idempotent recharge replay");

        GiftCard card = issue("100.00");
        String key = "recharge-" + UUID.randomUUID();
        printInput("Idempotency-Key", key);

        RechargeResult first = engine.recharge(ctx(key), GiftCardReference.byId(card.getId()),
            new BigDecimal("20.00"), null);
        RechargeResult second = engine.recharge(ctx(key), GiftCardReference.byId(card.getId()),
            new BigDecimal("20.00"), null);

        assertFalse(first.isReplayed());
        assertTrue(second.isReplayed());
        assertEquals(first.getTransaction().getId(), second.getTransaction().getId());
        assertEquals(first.getCommission().getId(), second.getCommission().getId());
        assertEquals(0, second.getGiftCard().getCurrentBalance().compareTo(new BigDecimal("120.00")));
        assertEquals(1, ledgerStore.findTransactions(card.getId()).size());
        printSuccess("One transaction, one commission");
    }

    @Test
    @DisplayName("Reusing a key for a different operation is a conflict")
    void testKeyReusedForDifferentOperation() {
        printTestHeader("Idempotency key reused for usage");

        GiftCard card = issue("100.00");
        String key = "key-" + UUID.randomUUID();
        engine.recharge(ctx(key), GiftCardReference.byId(card.getId()), new BigDecimal("10.00"), null);

        printExpectedException("ConflictException", "Idempotency key was already used for a different operation");
        assertThrows(ConflictException.class, () ->
            engine.use(ctx(key), GiftCardReference.byId(card.getId()), new BigDecimal("10.00"), null));

        GiftCard other = issue("100.00");
        assertThrows(ConflictException.class, () ->
            engine.recharge(ctx(key), GiftCardReference.byId(other.getId()), new BigDecimal("10.00"), null));
        printSuccess("Key bound to its first operation");
    }

    @Test
    @DisplayName("Usage by code is replay-safe and writes no commission")
    void testUseByCode() {
        printTestHeader("Use by code");

        GiftCard card = issue("80.00");
        String key = "use-" + UUID.randomUUID();

        UsageResult first = engine.use(ctx(key), GiftCardReference.byCode(card.getCode()),
            new BigDecimal("30.00"), "lunch");
        UsageResult replay = engine.use(ctx(key), GiftCardReference.byCode(card.getCode()),
            new BigDecimal("30.00"), "lunch");

        assertEquals(0, first.getGiftCard().getCurrentBalance().compareTo(new BigDecimal("50.00")));
        assertTrue(replay.isReplayed());
        assertEquals(first.getTransaction().getId(), replay.getTransaction().getId());
        Integer commissions = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM commissions WHERE establishment_id = ?", Integer.class, establishmentId);
        assertEquals(0, commissions);
        printSuccess("Usage applied once, no commission");
    }

    @Test
    @DisplayName("Amounts must be positive, have at most two decimals and stay under the maximum")
    void testAmountValidation() {
        printTestHeader("Amount validation");

        GiftCard card = issue("100.00");
        GiftCardReference ref = GiftCardReference.byId(card.getId());

        assertThrows(ValidationException.class, () -> engine.recharge(ctx(), ref, BigDecimal.ZERO, null));
        assertThrows(ValidationException.class, () -> engine.recharge(ctx(), ref, new BigDecimal("-1.00"), null));
        assertThrows(ValidationException.class, () -> engine.use(ctx(), ref, new BigDecimal("1.005"), null));
        assertThrows(ValidationException.class, () -> engine.recharge(ctx(), ref, new BigDecimal("10000.01"), null));
        assertThrows(ValidationException.class, () ->
            engine.create(ctx(), franchiseId, new BigDecimal("0.00"), null));

        assertEquals(0, ledgerStore.findById(card.getId()).orElseThrow()
            .getCurrentBalance().compareTo(new BigDecimal("100.00")));
        assertTrue(ledgerStore.findTransactions(card.getId()).isEmpty());
        printSuccess("Invalid amounts rejected before any mutation");
    }

    @Test
    @DisplayName("Unknown card reference is not found")
    void testUnknownCard() {
        printTestHeader("Unknown card");

        assertThrows(NotFoundException.class, () ->
            engine.use(ctx(), GiftCardReference.byCode("GC-NONE-NONE-NONE-NONE"), new BigDecimal("1.00"), null));
        assertThrows(NotFoundException.class, () -> engine.getBalance("GC-NONE-NONE-NONE-NONE"));
        assertThrows(NotFoundException.class, () -> engine.getGiftCard(UUID.randomUUID()));
        printSuccess("Not found reported");
    }

    @Test
    @DisplayName("Balance inquiry exposes the snapshot and the establishment, nothing else")
    void testBalanceInquiry() {
        printTestHeader("Balance inquiry");

        GiftCard card = issue("60.00");
        engine.use(ctx(), GiftCardReference.byId(card.getId()), new BigDecimal("15.50"), null);

        BalanceSnapshot snapshot = engine.getBalance(card.getCode());
        printOutput("Snapshot", snapshot);

        assertEquals(card.getCode(), snapshot.getCode());
        assertEquals(0, snapshot.getCurrentBalance().compareTo(new BigDecimal("44.50")));
        assertEquals(0, snapshot.getInitialValue().compareTo(new BigDecimal("60.00")));
        assertEquals(GiftCardStatus.ACTIVE, snapshot.getStatus());
        assertEquals("Food", snapshot.getEstablishment().getCategory());
        assertTrue(snapshot.getEstablishment().getName().startsWith("Cafe "));
        printSuccess("Snapshot correct");
    }

    @Test
    @DisplayName("Batch creation issues independent cards with distinct codes")
    void testCreateBatch() {
        printTestHeader("Batch creation");

        BatchIssueResult result = engine.createBatch(ctx(), franchiseId, new BigDecimal("25.00"), null, 5);
        printOutput("Created", result.getCreatedCount());

        assertTrue(result.isComplete());
        assertEquals(5, result.getCreated().size());
        assertTrue(result.getFailures().isEmpty());
        assertEquals(5, result.getCreated().stream().map(c -> c.getGiftCard().getCode()).distinct().count());

        assertThrows(ValidationException.class, () ->
            engine.createBatch(ctx(), franchiseId, new BigDecimal("25.00"), null, 0));
        printSuccess("Batch issued");
    }

    @Test
    @DisplayName("Only the owning establishment may cancel; cancelled cards stay cancelled")
    void testCancel() {
        printTestHeader("Cancel gift card");

        GiftCard card = issue("40.00");
        OperationContext stranger = new OperationContext("other", createEstablishment(franchiseId), null, null);

        assertThrows(InvalidOperationException.class, () -> engine.cancel(stranger, card.getId()));

        GiftCard cancelled = engine.cancel(ctx(), card.getId());
        assertEquals(GiftCardStatus.CANCELLED, cancelled.getStatus());
        assertEquals(0, cancelled.getCurrentBalance().compareTo(new BigDecimal("40.00")));

        assertThrows(InvalidOperationException.class, () -> engine.cancel(ctx(), card.getId()));
        assertThrows(InvalidOperationException.class, () ->
            engine.use(ctx(), GiftCardReference.byId(card.getId()), new BigDecimal("1.00"), null));
        printSuccess("Cancellation is owner-only and absorbing");
    }
}

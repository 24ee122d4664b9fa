package com.flagship.gift_card_ledger.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.gift_card_ledger.commission.Commission;
import com.flagship.gift_card_ledger.commission.CommissionStateStore;
import com.flagship.gift_card_ledger.commission.CommissionStatus;
import com.flagship.gift_card_ledger.directory.EstablishmentDirectory;
import com.flagship.gift_card_ledger.exception.ConflictException;
import com.flagship.gift_card_ledger.exception.GatewayException;
import com.flagship.gift_card_ledger.gateway.ChargeRequest;
import com.flagship.gift_card_ledger.gateway.ChargeResult;
import com.flagship.gift_card_ledger.gateway.CustomerProfile;
import com.flagship.gift_card_ledger.gateway.PaymentGatewayClient;
import com.flagship.gift_card_ledger.gateway.PaymentMethod;
import com.flagship.gift_card_ledger.giftcard.GiftCard;
import com.flagship.gift_card_ledger.giftcard.GiftCardEngine;
import com.flagship.gift_card_ledger.giftcard.GiftCardReference;
import com.flagship.gift_card_ledger.giftcard.OperationContext;
import com.flagship.gift_card_ledger.job.CommissionChargeJob;
import com.flagship.gift_card_ledger.job.PaymentWebhookJob;
import com.flagship.gift_card_ledger.observability.GiftCardMetrics;
import com.flagship.gift_card_ledger.settlement.GatewayCustomerRegistry;
import com.flagship.gift_card_ledger.settlement.SettlementService;
import com.flagship.gift_card_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A manual charge and a charge job racing for the same commission.
 *
 * The first gateway call blocks until the test releases it, so the second
 * caller always runs while the first charge is in flight.
 */
class CommissionChargeRaceTest extends IntegrationTestSupport {

    @Autowired
    private CommissionStateStore stateStore;

    @Autowired
    private EstablishmentDirectory directory;

    @Autowired
    private GatewayCustomerRegistry customerRegistry;

    @Autowired
    private GiftCardMetrics metrics;

    @Autowired
    private GiftCardEngine engine;

    @Autowired
    private ObjectMapper objectMapper;

    private BlockingGateway gateway;
    private SettlementService settlementService;
    private CommissionChargeJobConsumer consumer;
    private ExecutorService executor;
    private UUID franchiseId;
    private UUID establishmentId;

    @BeforeEach
    void setUp() {
        gateway = new BlockingGateway();
        settlementService = new SettlementService(stateStore, directory, customerRegistry, gateway, metrics,
            PaymentMethod.PIX, 3, 120);
        consumer = new CommissionChargeJobConsumer(stateStore, settlementService, objectMapper);
        executor = Executors.newSingleThreadExecutor();
        franchiseId = createFranchise("10.00");
        establishmentId = createEstablishment(franchiseId);
    }

    @AfterEach
    void tearDown() {
        gateway.releaseFirstCharge.countDown();
        executor.shutdownNow();
    }

    private Commission newCommission() {
        OperationContext ctx = new OperationContext("cashier", establishmentId, null, null);
        GiftCard card = engine.create(ctx, franchiseId, new BigDecimal("100.00"), null).getGiftCard();
        return engine.recharge(ctx, GiftCardReference.byId(card.getId()), new BigDecimal("40.00"), null)
            .getCommission();
    }

    private Commission reload(Commission commission) {
        return stateStore.findById(commission.getId()).orElseThrow();
    }

    private Future<SettlementService.ChargeOutcome> manualChargeInFlight(Commission commission)
            throws InterruptedException {
        Future<SettlementService.ChargeOutcome> manual = executor.submit(() ->
            settlementService.requestCharge(commission.getId(), PaymentMethod.PIX, null, null));
        assertTrue(gateway.firstChargeEntered.await(10, TimeUnit.SECONDS), "Manual charge reached the gateway");
        return manual;
    }

    private void expireClaim(Commission commission) {
        jdbcTemplate.update(
            "UPDATE commissions SET charge_claimed_at = charge_claimed_at - INTERVAL '10 minutes' WHERE id = ?",
            commission.getId());
    }

    private static PaymentWebhookJob confirmation(Commission commission, String chargeRef) {
        return new PaymentWebhookJob(UUID.randomUUID(), "PAYMENT_CONFIRMED", chargeRef,
            commission.getExternalReference(), commission.getAmount(), Instant.now(), Instant.now());
    }

    @Test
    @DisplayName("A charge job arriving while a manual charge is in flight never reaches the gateway")
    void testJobDuringManualCharge() throws Exception {
        printTestHeader("Charge job during manual charge");

        // Given: a manual charge blocked inside the gateway call
        Commission commission = newCommission();
        Future<SettlementService.ChargeOutcome> manual = manualChargeInFlight(commission);
        gateway.declineAfterFirst = true;

        // When: the charge job runs
        printExpectedException("ConflictException", "charge already in progress");
        ConflictException conflict = assertThrows(ConflictException.class,
            () -> consumer.handle(CommissionChargeJob.forCommission(commission.getId())));
        printOutput("Job outcome", conflict.getMessage());
        assertEquals(1, gateway.calls.get(), "Job did not call the gateway");

        // Then: the manual charge completes and the redelivered job has nothing to do
        gateway.releaseFirstCharge.countDown();
        String chargeRef = manual.get(10, TimeUnit.SECONDS).charge().getChargeRef();
        consumer.handle(CommissionChargeJob.forCommission(commission.getId()));

        Commission charged = reload(commission);
        printOutput("Commission", charged.getStatus() + " " + charged.getGatewayChargeId());
        assertEquals(CommissionStatus.CHARGED, charged.getStatus());
        assertEquals(chargeRef, charged.getGatewayChargeId());
        assertNull(charged.getChargeAttemptId());
        assertEquals(1, gateway.calls.get());

        settlementService.applyWebhookEvent(confirmation(commission, chargeRef));
        assertEquals(CommissionStatus.PAID, reload(commission).getStatus());
        printSuccess("One gateway charge, payment applied");
    }

    @Test
    @DisplayName("A late rejection from a superseded attempt leaves the recorded charge payable")
    void testLateRejectionAfterTakeover() throws Exception {
        printTestHeader("Late rejection after takeover");

        // Given: the first attempt hangs in the gateway past its claim timeout
        Commission commission = newCommission();
        gateway.declineFirst = true;
        Future<SettlementService.ChargeOutcome> stalled = manualChargeInFlight(commission);
        expireClaim(commission);

        // When: a job takes over and charges, then the first attempt is declined
        consumer.handle(CommissionChargeJob.forCommission(commission.getId()));
        Commission charged = reload(commission);
        assertEquals(CommissionStatus.CHARGED, charged.getStatus());

        gateway.releaseFirstCharge.countDown();
        ExecutionException failure = assertThrows(ExecutionException.class, () -> stalled.get(10, TimeUnit.SECONDS));
        assertInstanceOf(GatewayException.class, failure.getCause());

        // Then: the rejection was not applied and the payment still lands
        Commission after = reload(commission);
        printOutput("Commission", after.getStatus() + " " + after.getGatewayChargeId()
            + " reason=" + after.getFailureReason());
        assertEquals(CommissionStatus.CHARGED, after.getStatus());
        assertEquals(charged.getGatewayChargeId(), after.getGatewayChargeId());
        assertNull(after.getFailureReason());
        assertFalse(after.isAwaitingCharge());

        settlementService.applyWebhookEvent(confirmation(commission, after.getGatewayChargeId()));
        assertEquals(CommissionStatus.PAID, reload(commission).getStatus());
        printSuccess("Winner's charge settled");
    }

    @Test
    @DisplayName("A charge created by a superseded attempt is deleted at the gateway")
    void testSupersededChargeDeleted() throws Exception {
        printTestHeader("Superseded charge deleted");

        Commission commission = newCommission();
        Future<SettlementService.ChargeOutcome> stalled = manualChargeInFlight(commission);
        expireClaim(commission);

        consumer.handle(CommissionChargeJob.forCommission(commission.getId()));
        String recorded = reload(commission).getGatewayChargeId();

        gateway.releaseFirstCharge.countDown();
        ExecutionException failure = assertThrows(ExecutionException.class, () -> stalled.get(10, TimeUnit.SECONDS));
        assertInstanceOf(ConflictException.class, failure.getCause());

        Commission after = reload(commission);
        printOutput("Recorded / deleted", after.getGatewayChargeId() + " / " + gateway.cancelled);
        assertEquals(recorded, after.getGatewayChargeId());
        assertEquals(1, after.getChargeAttempts());
        assertEquals(Set.of(BlockingGateway.chargeRef(1)), gateway.cancelled);
        assertNotEquals(BlockingGateway.chargeRef(1), recorded);
        printSuccess("Orphaned charge removed");
    }

    /**
     * Gateway whose first charge call waits for {@link #releaseFirstCharge}.
     */
    static class BlockingGateway implements PaymentGatewayClient {

        final CountDownLatch firstChargeEntered = new CountDownLatch(1);
        final CountDownLatch releaseFirstCharge = new CountDownLatch(1);
        final AtomicInteger calls = new AtomicInteger();
        final Set<String> cancelled = ConcurrentHashMap.newKeySet();
        volatile boolean declineFirst;
        volatile boolean declineAfterFirst;

        static String chargeRef(int call) {
            return "pay_race_" + call;
        }

        @Override
        public String createCustomer(CustomerProfile profile) {
            return "cus_race";
        }

        @Override
        public ChargeResult createCharge(ChargeRequest request) {
            int call = calls.incrementAndGet();
            if (call == 1) {
                firstChargeEntered.countDown();
                try {
                    releaseFirstCharge.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new GatewayException("Interrupted while charging", e);
                }
                if (declineFirst) {
                    throw new GatewayException("Card declined");
                }
            } else if (declineAfterFirst) {
                throw new GatewayException("Card declined");
            }
            return new ChargeResult(chargeRef(call), "PENDING", "https://gateway.test/i/" + call, null);
        }

        @Override
        public void cancelCharge(String chargeRef) {
            cancelled.add(chargeRef);
        }
    }
}

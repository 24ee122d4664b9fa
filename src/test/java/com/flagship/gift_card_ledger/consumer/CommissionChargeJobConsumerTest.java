package com.flagship.gift_card_ledger.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.gift_card_ledger.commission.Commission;
import com.flagship.gift_card_ledger.commission.CommissionFailureReason;
import com.flagship.gift_card_ledger.commission.CommissionStateStore;
import com.flagship.gift_card_ledger.commission.CommissionStatus;
import com.flagship.gift_card_ledger.gateway.FakePaymentGatewayClient;
import com.flagship.gift_card_ledger.gateway.PaymentMethod;
import com.flagship.gift_card_ledger.giftcard.GiftCard;
import com.flagship.gift_card_ledger.giftcard.GiftCardEngine;
import com.flagship.gift_card_ledger.giftcard.GiftCardReference;
import com.flagship.gift_card_ledger.giftcard.OperationContext;
import com.flagship.gift_card_ledger.job.CommissionChargeJob;
import com.flagship.gift_card_ledger.settlement.SettlementService;
import com.flagship.gift_card_ledger.support.IntegrationTestSupport;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.kafka.support.Acknowledgment;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Charge jobs are delivered at least once; a repeated or outdated job must
 * leave the commission as it is.
 */
class CommissionChargeJobConsumerTest extends IntegrationTestSupport {

    @Autowired
    private CommissionStateStore stateStore;

    @Autowired
    private SettlementService settlementService;

    @Autowired
    private GiftCardEngine engine;

    @Autowired
    private ObjectMapper objectMapper;

    private CommissionChargeJobConsumer consumer;
    private UUID franchiseId;
    private UUID establishmentId;

    @BeforeEach
    void setUp() {
        // Listeners are disabled in tests; drive the consumer directly.
        consumer = new CommissionChargeJobConsumer(stateStore, settlementService, objectMapper);
        franchiseId = createFranchise("8.00");
        establishmentId = createEstablishment(franchiseId);
    }

    private Commission newCommission() {
        OperationContext ctx = new OperationContext("cashier", establishmentId, null, null);
        GiftCard card = engine.create(ctx, franchiseId, new BigDecimal("100.00"), null).getGiftCard();
        return engine.recharge(ctx, GiftCardReference.byId(card.getId()), new BigDecimal("25.00"), null)
            .getCommission();
    }

    private Commission reload(Commission commission) {
        return stateStore.findById(commission.getId()).orElseThrow();
    }

    @Test
    @DisplayName("Job charges a PENDING commission; the duplicate delivery does nothing")
    void testJobChargesOnce() {
        printTestHeader("Charge job delivered twice");

        Commission commission = newCommission();
        CommissionChargeJob job = CommissionChargeJob.forCommission(commission.getId());

        consumer.handle(job);
        Commission charged = reload(commission);
        printOutput("After first delivery", charged.getStatus() + " " + charged.getGatewayChargeId());
        assertEquals(CommissionStatus.CHARGED, charged.getStatus());

        consumer.handle(job);
        Commission again = reload(commission);
        assertEquals(charged.getGatewayChargeId(), again.getGatewayChargeId());
        assertEquals(1, again.getChargeAttempts());
        printSuccess("Single gateway charge");
    }

    @Test
    @DisplayName("Job retries a rejected charge but not one whose retries are exhausted")
    void testFailedCommissions() {
        printTestHeader("Charge job on FAILED commissions");

        Commission rejected = newCommission();
        assertThrows(RuntimeException.class, () -> settlementService.requestCharge(rejected.getId(),
            PaymentMethod.CREDIT_CARD, LocalDate.now(), FakePaymentGatewayClient.DECLINED_TOKEN));
        assertEquals(CommissionFailureReason.CHARGE_REJECTED, reload(rejected).getFailureReason());

        consumer.handle(CommissionChargeJob.forCommission(rejected.getId()));
        assertEquals(CommissionStatus.CHARGED, reload(rejected).getStatus());

        Commission exhausted = newCommission();
        settlementService.markChargeRetriesExhausted(exhausted.getId(), "timeout");
        consumer.handle(CommissionChargeJob.forCommission(exhausted.getId()));
        assertEquals(CommissionStatus.FAILED, reload(exhausted).getStatus());
        assertNull(reload(exhausted).getGatewayChargeId());
        printSuccess("Only the rejected charge was retried");
    }

    @Test
    @DisplayName("Job for an unknown commission is a no-op")
    void testUnknownCommission() {
        assertDoesNotThrow(() -> consumer.handle(CommissionChargeJob.forCommission(UUID.randomUUID())));
    }

    @Test
    @DisplayName("Record is read, executed and acknowledged; unreadable records are acknowledged and skipped")
    void testConsumeRecord() throws Exception {
        printTestHeader("Consume Kafka records");

        Commission commission = newCommission();
        CommissionChargeJob job = new CommissionChargeJob(UUID.randomUUID(), commission.getId(),
            PaymentMethod.BOLETO, LocalDate.now().plusDays(5), Instant.now());
        String payload = objectMapper.writeValueAsString(job);
        printInput("Payload", payload);

        Acknowledgment ack = mock(Acknowledgment.class);
        consumer.consume(new ConsumerRecord<>("gift-card.commission-charge-jobs", 0, 0L,
            commission.getId().toString(), payload), ack);

        verify(ack).acknowledge();
        Commission charged = reload(commission);
        assertEquals(CommissionStatus.CHARGED, charged.getStatus());
        assertEquals(PaymentMethod.BOLETO, charged.getPaymentMethod());
        assertEquals(LocalDate.now().plusDays(5), charged.getDueDate());

        Acknowledgment skipAck = mock(Acknowledgment.class);
        consumer.consume(new ConsumerRecord<>("gift-card.commission-charge-jobs", 0, 1L,
            "key", "not json"), skipAck);
        verify(skipAck).acknowledge();
        printSuccess("Records handled");
    }
}

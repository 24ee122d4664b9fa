package com.flagship.gift_card_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.gift_card_ledger.job.JobKind;
import com.flagship.gift_card_ledger.job.PaymentWebhookJob;
import com.flagship.gift_card_ledger.settlement.PaymentEventKind;
import com.flagship.gift_card_ledger.settlement.SettlementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Applies queued gateway notifications.
 *
 * Deduplicated by delivery id (charge reference plus event code), so a
 * notification the gateway sends twice is applied once. Event codes this
 * service does not handle are recorded as skipped without touching the
 * commission.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PaymentWebhookJobConsumer {

    static final String CONSUMER_GROUP = "payment-webhook-worker";

    private final IdempotentEventProcessor eventProcessor;
    private final SettlementService settlementService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.payment-webhook-jobs:gift-card.payment-webhook-jobs}",
        groupId = "${spring.kafka.consumer.group-id:gift-card-ledger-workers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received webhook job: partition={}, offset={}, key={}",
            record.partition(), record.offset(), record.key());

        PaymentWebhookJob job;
        try {
            job = objectMapper.readValue(record.value(), PaymentWebhookJob.class);
        } catch (JsonProcessingException e) {
            log.error("Unreadable webhook job at offset {}, acknowledging to skip: {}", record.offset(), e.getMessage());
            ack.acknowledge();
            return;
        }

        handle(job);
        ack.acknowledge();
    }

    boolean handle(PaymentWebhookJob job) {
        if (PaymentEventKind.fromGatewayCode(job.getEventCode()) == PaymentEventKind.UNRECOGNIZED) {
            log.info("Ignoring unhandled gateway event {} for charge {}", job.getEventCode(), job.getChargeRef());
            eventProcessor.skipEvent(
                job.deliveryId(),
                String.valueOf(job.getEventCode()),
                JobKind.PAYMENT_WEBHOOK.getAggregateType(),
                job.partitionKey(),
                CONSUMER_GROUP,
                "unhandled event code");
            return false;
        }

        boolean processed = eventProcessor.processEvent(
            job.deliveryId(),
            job.getEventCode(),
            JobKind.PAYMENT_WEBHOOK.getAggregateType(),
            job.partitionKey(),
            CONSUMER_GROUP,
            () -> settlementService.applyWebhookEvent(job)
        );
        if (processed) {
            log.info("Applied gateway event {} for charge {}", job.getEventCode(), job.getChargeRef());
        }
        return processed;
    }
}

package com.flagship.gift_card_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.gift_card_ledger.commission.Commission;
import com.flagship.gift_card_ledger.commission.CommissionStateStore;
import com.flagship.gift_card_ledger.job.CommissionChargeJob;
import com.flagship.gift_card_ledger.observability.CorrelationIdFilter;
import com.flagship.gift_card_ledger.settlement.SettlementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Executes commission charge jobs.
 *
 * The commission is re-read when the job runs: a job for a commission that is
 * already CHARGED, PAID, or FAILED for a reason other than a rejected charge
 * does nothing. Exceptions propagate to the container's error handler, which
 * retries with backoff and finally hands the record to {@link FailedJobRecoverer}.
 * A job that finds another charge attempt in flight fails with a conflict and
 * is retried the same way; by then the commission is usually CHARGED.
 *
 * No processed-event record is kept: the commission's own status makes a
 * repeated job a no-op, and a rejected charge must stay retryable.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CommissionChargeJobConsumer {

    private final CommissionStateStore stateStore;
    private final SettlementService settlementService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.commission-charge-jobs:gift-card.commission-charge-jobs}",
        groupId = "${spring.kafka.consumer.group-id:gift-card-ledger-workers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received charge job: partition={}, offset={}, key={}",
            record.partition(), record.offset(), record.key());

        CommissionChargeJob job;
        try {
            job = objectMapper.readValue(record.value(), CommissionChargeJob.class);
        } catch (JsonProcessingException e) {
            log.error("Unreadable charge job at offset {}, acknowledging to skip: {}", record.offset(), e.getMessage());
            ack.acknowledge();
            return;
        }

        MDC.put(CorrelationIdFilter.COMMISSION_ID_MDC_KEY, job.getCommissionId().toString());
        try {
            handle(job);
            ack.acknowledge();
        } finally {
            MDC.remove(CorrelationIdFilter.COMMISSION_ID_MDC_KEY);
        }
    }

    void handle(CommissionChargeJob job) {
        Optional<Commission> commission = stateStore.findById(job.getCommissionId());
        if (commission.isEmpty()) {
            log.warn("Charge job {} refers to unknown commission {}", job.getJobId(), job.getCommissionId());
            return;
        }
        if (!commission.get().isAwaitingCharge()) {
            log.info("Commission {} is {} ({}), charge job {} has nothing to do",
                job.getCommissionId(), commission.get().getStatus(), commission.get().getFailureReason(),
                job.getJobId());
            return;
        }

        settlementService.requestCharge(job.getCommissionId(), job.getPaymentMethod(), job.getDueDate(), null);
    }
}

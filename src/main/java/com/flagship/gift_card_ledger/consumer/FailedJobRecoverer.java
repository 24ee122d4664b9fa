package com.flagship.gift_card_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.gift_card_ledger.job.JobKind;
import com.flagship.gift_card_ledger.observability.GiftCardMetrics;
import com.flagship.gift_card_ledger.settlement.SettlementService;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.listener.ConsumerRecordRecoverer;
import org.springframework.kafka.listener.ListenerExecutionFailedException;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Final step for a job whose attempts are exhausted.
 *
 * Writes the job to {@code failed_jobs}. For a commission charge the
 * commission is also marked FAILED with reason CHARGE_RETRIES_EXHAUSTED.
 * Runs on the listener thread after the error handler gives up; the record's
 * offset is committed afterwards.
 */
@Component
@Slf4j
public class FailedJobRecoverer implements ConsumerRecordRecoverer {

    private final FailedJobRepository repository;
    private final SettlementService settlementService;
    private final GiftCardMetrics metrics;
    private final ObjectMapper objectMapper;
    private final String commissionChargeTopic;
    private final String paymentWebhookTopic;
    private final int attempts;

    public FailedJobRecoverer(FailedJobRepository repository,
                              SettlementService settlementService,
                              GiftCardMetrics metrics,
                              ObjectMapper objectMapper,
                              @Value("${kafka.topic.commission-charge-jobs:gift-card.commission-charge-jobs}")
                              String commissionChargeTopic,
                              @Value("${kafka.topic.payment-webhook-jobs:gift-card.payment-webhook-jobs}")
                              String paymentWebhookTopic,
                              @Value("${jobs.attempts:3}") int attempts) {
        this.repository = repository;
        this.settlementService = settlementService;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.commissionChargeTopic = commissionChargeTopic;
        this.paymentWebhookTopic = paymentWebhookTopic;
        this.attempts = attempts;
    }

    @Override
    public void accept(ConsumerRecord<?, ?> record, Exception exception) {
        String kind = kindOf(record.topic()).map(Enum::name).orElse(record.topic());
        String key = record.key() != null ? record.key().toString() : "";
        String payload = record.value() != null ? record.value().toString() : null;
        String error = rootMessage(exception);

        log.error("Job {} with key {} failed after {} attempt(s): {}", kind, key, attempts, error);
        metrics.recordJobFailure(kind);

        repository.save(FailedJobEntity.record(kind, key, asJson(payload), error, attempts));

        if (commissionChargeTopic.equals(record.topic())) {
            commissionIdOf(payload).ifPresent(commissionId -> {
                try {
                    settlementService.markChargeRetriesExhausted(commissionId, error);
                } catch (RuntimeException e) {
                    log.error("Could not mark commission {} as retries exhausted: {}", commissionId, e.getMessage(), e);
                }
            });
        }
    }

    private Optional<JobKind> kindOf(String topic) {
        if (commissionChargeTopic.equals(topic)) {
            return Optional.of(JobKind.COMMISSION_CHARGE);
        }
        if (paymentWebhookTopic.equals(topic)) {
            return Optional.of(JobKind.PAYMENT_WEBHOOK);
        }
        return Optional.empty();
    }

    private Optional<UUID> commissionIdOf(String payload) {
        try {
            JsonNode node = objectMapper.readTree(payload);
            return Optional.ofNullable(node.get("commissionId"))
                .map(JsonNode::asText)
                .map(UUID::fromString);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Failed charge job has no readable commission id: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // failed_jobs.payload is jsonb; non-JSON values are stored as a JSON string.
    private String asJson(String payload) {
        if (payload == null) {
            return "null";
        }
        try {
            objectMapper.readTree(payload);
            return payload;
        } catch (JsonProcessingException e) {
            try {
                return objectMapper.writeValueAsString(payload);
            } catch (JsonProcessingException impossible) {
                throw new IllegalStateException(impossible);
            }
        }
    }

    private static String rootMessage(Exception exception) {
        Throwable cause = exception;
        while (cause instanceof ListenerExecutionFailedException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

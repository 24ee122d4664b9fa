package com.flagship.gift_card_ledger.outbox;

import com.flagship.gift_card_ledger.job.JobKind;
import com.flagship.gift_card_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Forwards outbox rows to Kafka.
 *
 * Rows are sent synchronously, keyed by aggregate id, so jobs for the same
 * commission (or the same gateway charge) stay on one partition in order.
 * A row that keeps failing is retried on later polls until
 * {@code outbox.publisher.max-retries}, after which it stays in the table as a
 * dead letter.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.commission-charge-jobs:gift-card.commission-charge-jobs}")
    private String commissionChargeTopic;

    @Value("${kafka.topic.payment-webhook-jobs:gift-card.payment-webhook-jobs}")
    private String paymentWebhookTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }
            log.debug("Found {} unpublished outbox events", events.size());
            events.forEach(this::publishEvent);
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        try {
            String topic = topicFor(event);
            SendResult<String, String> result = kafkaTemplate
                    .send(topic, event.getAggregateId().toString(), event.getPayload())
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            log.debug("Published outbox event: id={}, topic={}, partition={}, offset={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
        } catch (Exception e) {
            log.error("Failed to publish outbox event: id={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Outbox event {} reached max retries ({}) and is now dead-lettered: aggregateType={}, aggregateId={}",
                        event.getId(), maxRetries, event.getAggregateType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    String topicFor(OutboxEvent event) {
        JobKind kind = JobKind.fromAggregateType(event.getAggregateType())
                .orElseThrow(() -> new IllegalStateException(
                        "No topic mapped for aggregate type " + event.getAggregateType()));
        return switch (kind) {
            case COMMISSION_CHARGE -> commissionChargeTopic;
            case PAYMENT_WEBHOOK -> paymentWebhookTopic;
        };
    }

    /**
     * Runs one publish pass immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }

    public long getUnpublishedCount() {
        return outboxService.countUnpublished();
    }
}

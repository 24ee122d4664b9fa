package com.flagship.gift_card_ledger.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Runs a job handler at most once per delivery id and consumer group.
 *
 * The handler and the processed-event record share one transaction: either
 * both commit, or neither does and the delivery is retried. Handlers that
 * write to the database should join the caller's transaction.
 *
 * <pre>
 * processor.processEvent(deliveryId, eventType, aggregateType, aggregateId, consumerGroup,
 *     () -> settlementService.applyWebhookEvent(job));
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the delivery was a duplicate
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType,
                                String aggregateType, UUID aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        handler.run();

        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.success(
            eventId, eventType, aggregateType, aggregateId, consumerGroup)));
        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    /**
     * Records a delivery as handled without running anything, so replays skip it.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType,
                          String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.skipped(
            eventId, eventType, aggregateType, aggregateId, consumerGroup, reason)));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}

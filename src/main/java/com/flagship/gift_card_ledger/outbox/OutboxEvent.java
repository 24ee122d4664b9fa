package com.flagship.gift_card_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A row of the transactional outbox: a job or event written in the same
 * database transaction as the state change that produced it, and forwarded
 * to Kafka afterwards.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // selects the topic, e.g. "CommissionChargeJob"
    UUID aggregateId;          // Kafka key
    String eventType;
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until forwarded
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean hasExhaustedRetries(int maxRetries) {
        return retryCount >= maxRetries;
    }
}

package com.flagship.gift_card_ledger.job;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of background work. Each kind has its own outbox aggregate type and
 * its own Kafka topic.
 */
public enum JobKind {
    COMMISSION_CHARGE("CommissionChargeJob", "CommissionChargeRequested"),
    PAYMENT_WEBHOOK("PaymentWebhookJob", "PaymentWebhookReceived");

    private final String aggregateType;
    private final String eventType;

    JobKind(String aggregateType, String eventType) {
        this.aggregateType = aggregateType;
        this.eventType = eventType;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public String getEventType() {
        return eventType;
    }

    public static Optional<JobKind> fromAggregateType(String aggregateType) {
        return Arrays.stream(values())
                .filter(kind -> kind.aggregateType.equals(aggregateType))
                .findFirst();
    }
}

package com.flagship.gift_card_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for gift card and commission operations.
 *
 * Metrics exposed:
 * - giftcard.issued: cards created
 * - giftcard.operations: balance changes, tagged by type and outcome
 * - giftcard.operation.duration: latency of balance changes
 * - commission.transitions: state machine outcomes, tagged by event and outcome
 * - commission.overdue: overdue notifications received from the gateway
 * - idempotency.cache: replayed vs new keyed requests
 */
@Component
public class GiftCardMetrics {

    private final MeterRegistry registry;
    private final Counter cardsIssued;
    private final Counter overdueNotifications;

    public GiftCardMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.cardsIssued = Counter.builder("giftcard.issued")
                .description("Number of gift cards created")
                .register(registry);

        this.overdueNotifications = Counter.builder("commission.overdue")
                .description("Overdue notifications received for commission charges")
                .register(registry);
    }

    public void recordCardIssued() {
        cardsIssued.increment();
    }

    public void recordBalanceOperation(String type, String outcome, Duration duration) {
        registry.counter("giftcard.operations",
                "type", sanitizeTag(type),
                "outcome", sanitizeTag(outcome)
        ).increment();
        Timer.builder("giftcard.operation.duration")
                .tag("type", sanitizeTag(type))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    public void recordCommissionTransition(String event, String outcome) {
        registry.counter("commission.transitions",
                "event", sanitizeTag(event),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordCommissionCreationFailure() {
        registry.counter("commission.creation.failures").increment();
    }

    public void recordOrphanedCharge() {
        registry.counter("commission.charges.orphaned").increment();
    }

    public void recordOverdueNotification() {
        overdueNotifications.increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordJobFailure(String jobKind) {
        registry.counter("jobs.failed", "kind", sanitizeTag(jobKind)).increment();
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

package com.flagship.gift_card_ledger.job;

import com.flagship.gift_card_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * {@link JobQueue} backed by the transactional outbox. The outbox publisher
 * forwards rows to the job kind's Kafka topic; consumers execute them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxJobQueue implements JobQueue {

    private final OutboxService outboxService;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void enqueue(JobKind kind, UUID key, Object payload) {
        outboxService.saveEvent(kind.getAggregateType(), key, kind.getEventType(), payload);
        log.debug("Enqueued {} job for key {}", kind, key);
    }
}

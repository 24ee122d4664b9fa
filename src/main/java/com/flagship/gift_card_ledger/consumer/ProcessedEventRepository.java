package com.flagship.gift_card_ledger.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, UUID> {

    boolean existsByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    /**
     * Deliveries recorded for one gateway charge, oldest first. The aggregate
     * id of a webhook delivery is its partition key.
     */
    List<ProcessedEventEntity> findByAggregateIdOrderByProcessedAtAsc(UUID aggregateId);
}

package com.flagship.gift_card_ledger.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FailedJobRepository extends JpaRepository<FailedJobEntity, UUID> {

    List<FailedJobEntity> findByJobKindAndJobKeyOrderByFailedAtDesc(String jobKind, String jobKey);
}

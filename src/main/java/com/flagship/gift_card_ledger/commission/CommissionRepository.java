package com.flagship.gift_card_ledger.commission;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CommissionRepository extends JpaRepository<CommissionEntity, UUID> {

    /**
     * Loads a commission with a row lock held until the surrounding transaction
     * ends. All status changes go through this.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CommissionEntity c WHERE c.id = :id")
    Optional<CommissionEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<CommissionEntity> findByGatewayChargeId(String gatewayChargeId);

    Optional<CommissionEntity> findByExternalReference(String externalReference);

    Optional<CommissionEntity> findByTransactionId(UUID transactionId);

    List<CommissionEntity> findAllByOrderByCreatedAtDesc();

    List<CommissionEntity> findByStatusOrderByCreatedAtDesc(CommissionStatus status);

    List<CommissionEntity> findByEstablishmentIdOrderByCreatedAtDesc(UUID establishmentId);

    List<CommissionEntity> findByStatusAndEstablishmentIdOrderByCreatedAtDesc(CommissionStatus status,
                                                                             UUID establishmentId);

    long countByStatus(CommissionStatus status);
}

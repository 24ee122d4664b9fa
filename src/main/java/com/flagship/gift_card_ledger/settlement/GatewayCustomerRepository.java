package com.flagship.gift_card_ledger.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface GatewayCustomerRepository extends JpaRepository<GatewayCustomerEntity, UUID> {
}

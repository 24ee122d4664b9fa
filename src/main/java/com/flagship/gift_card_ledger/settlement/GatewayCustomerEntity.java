package com.flagship.gift_card_ledger.settlement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Gateway customer created on behalf of an establishment. One per
 * establishment; never updated.
 */
@Entity
@Table(name = "establishment_gateway_customers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GatewayCustomerEntity {

    @Id
    @Column(name = "establishment_id", nullable = false, updatable = false)
    private UUID establishmentId;

    @Column(name = "customer_ref", nullable = false, updatable = false, length = 100)
    private String customerRef;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static GatewayCustomerEntity of(UUID establishmentId, String customerRef) {
        return new GatewayCustomerEntity(establishmentId, customerRef, null);
    }
}

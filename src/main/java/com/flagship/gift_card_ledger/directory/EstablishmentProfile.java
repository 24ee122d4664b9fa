package com.flagship.gift_card_ledger.directory;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Read-only view of an establishment joined with its franchise.
 *
 * The commission rate belongs to the franchise and is read at the moment it
 * is needed; callers that must keep it stable snapshot it themselves.
 */
@Value
public class EstablishmentProfile {
    UUID id;
    UUID franchiseId;
    String name;
    String category;
    String document;
    String email;
    String phone;
    BigDecimal commissionRate;

    public boolean belongsTo(UUID franchiseId) {
        return this.franchiseId.equals(franchiseId);
    }
}

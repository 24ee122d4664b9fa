package com.flagship.gift_card_ledger.giftcard;

import com.flagship.gift_card_ledger.exception.ValidationException;

import java.util.UUID;

/**
 * Who is performing an operation and on behalf of which establishment.
 * Built at the edge (controller or job) and passed down explicitly.
 *
 * @param actor          caller identity, for the audit trail
 * @param establishmentId establishment performing the operation
 * @param idempotencyKey optional client key making the operation replay-safe
 * @param correlationId  request correlation id
 */
public record OperationContext(String actor, UUID establishmentId,
                               String idempotencyKey, String correlationId) {

    public OperationContext {
        if (establishmentId == null) {
            throw new ValidationException("Establishment id is required");
        }
        if (actor == null || actor.isBlank()) {
            actor = "anonymous";
        }
        if (idempotencyKey != null && idempotencyKey.isBlank()) {
            idempotencyKey = null;
        }
    }

    public boolean hasIdempotencyKey() {
        return idempotencyKey != null;
    }
}

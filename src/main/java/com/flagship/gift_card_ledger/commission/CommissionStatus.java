package com.flagship.gift_card_ledger.commission;

/**
 * Settlement status of a commission.
 *
 * PENDING: created, no gateway charge yet.
 * CHARGED: a gateway charge exists and is awaiting payment.
 * PAID: terminal, the establishment paid the charge.
 * FAILED: the charge was rejected, cancelled or refunded. A new charge may be
 * requested from this state.
 */
public enum CommissionStatus {
    PENDING,
    CHARGED,
    PAID,
    FAILED
}

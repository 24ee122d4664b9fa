package com.flagship.gift_card_ledger.commission;

/**
 * Inputs to the commission state machine.
 */
public enum CommissionEvent {
    CHARGE_CREATED,
    CHARGE_REJECTED,
    CHARGE_RETRIES_EXHAUSTED,
    PAYMENT_CONFIRMED,
    PAYMENT_OVERDUE,
    PAYMENT_DELETED,
    PAYMENT_REFUNDED
}

package com.flagship.gift_card_ledger.commission;

/**
 * Why a commission ended up FAILED.
 */
public enum CommissionFailureReason {
    CHARGE_REJECTED,
    CHARGE_RETRIES_EXHAUSTED,
    PAYMENT_DELETED,
    PAYMENT_REFUNDED;

    /**
     * Only a rejected charge is worth retrying automatically; every other
     * reason needs an explicit charge request.
     */
    public boolean isRetryable() {
        return this == CHARGE_REJECTED;
    }
}

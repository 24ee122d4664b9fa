package com.flagship.gift_card_ledger.giftcard;

/**
 * Lifecycle of a gift card. Only {@code ACTIVE} cards accept balance changes;
 * the other states are absorbing.
 */
public enum GiftCardStatus {
    ACTIVE,
    USED,
    EXPIRED,
    CANCELLED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}

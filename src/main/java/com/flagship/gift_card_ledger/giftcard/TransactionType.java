package com.flagship.gift_card_ledger.giftcard;

public enum TransactionType {
    RECHARGE,
    USAGE,
    REFUND;

    /**
     * Credits raise the balance, debits lower it.
     */
    public boolean isCredit() {
        return this != USAGE;
    }
}

package com.flagship.gift_card_ledger.gateway;

/**
 * Ways an establishment can pay a commission charge.
 */
public enum PaymentMethod {
    PIX,
    BOLETO,
    CREDIT_CARD;

    /**
     * Card charges need a stored card token.
     */
    public boolean requiresCardToken() {
        return this == CREDIT_CARD;
    }
}

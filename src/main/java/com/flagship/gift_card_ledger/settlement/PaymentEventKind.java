package com.flagship.gift_card_ledger.settlement;

import java.util.Locale;

/**
 * Gateway payment notifications this service understands.
 *
 * Classification is total: any code not listed maps to {@link #UNRECOGNIZED}.
 */
public enum PaymentEventKind {
    CONFIRMED,
    RECEIVED,
    OVERDUE,
    DELETED,
    REFUNDED,
    UNRECOGNIZED;

    public static PaymentEventKind fromGatewayCode(String eventCode) {
        if (eventCode == null) {
            return UNRECOGNIZED;
        }
        return switch (eventCode.trim().toUpperCase(Locale.ROOT)) {
            case "PAYMENT_CONFIRMED" -> CONFIRMED;
            case "PAYMENT_RECEIVED" -> RECEIVED;
            case "PAYMENT_OVERDUE" -> OVERDUE;
            case "PAYMENT_DELETED" -> DELETED;
            case "PAYMENT_REFUNDED", "PAYMENT_CHARGEBACK_REQUESTED" -> REFUNDED;
            default -> UNRECOGNIZED;
        };
    }
}

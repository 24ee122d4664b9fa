package com.flagship.gift_card_ledger.giftcard;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * What an anonymous balance inquiry may see. No ids, no history.
 */
@Value
public class BalanceSnapshot {
    String code;
    BigDecimal currentBalance;
    BigDecimal initialValue;
    GiftCardStatus status;
    Instant validUntil;
    Establishment establishment;

    @Value
    public static class Establishment {
        String name;
        String category;
    }
}

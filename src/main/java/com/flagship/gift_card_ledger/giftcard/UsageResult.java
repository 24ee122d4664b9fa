package com.flagship.gift_card_ledger.giftcard;

import lombok.Value;

@Value
public class UsageResult {
    GiftCardTransaction transaction;
    GiftCard giftCard;
    boolean replayed;
}

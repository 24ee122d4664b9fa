package com.flagship.gift_card_ledger.giftcard;

import lombok.Value;

/**
 * The card and transaction written together by one balance change.
 */
@Value
public class BalanceChange {
    GiftCard giftCard;
    GiftCardTransaction transaction;
}

package com.flagship.gift_card_ledger.giftcard;

import com.flagship.gift_card_ledger.commission.Commission;
import lombok.Value;

/**
 * Result of a recharge. {@code commission} is null when commission creation
 * failed after the balance change committed; the backfill sweep creates it later.
 */
@Value
public class RechargeResult {
    GiftCardTransaction transaction;
    GiftCard giftCard;
    Commission commission;
    boolean replayed;
}

package com.flagship.gift_card_ledger.giftcard.dto;

import com.flagship.gift_card_ledger.giftcard.UsageResult;
import lombok.Value;

@Value
public class UsageResponse {
    TransactionResponse transaction;
    GiftCardResponse giftCard;

    public static UsageResponse from(UsageResult result) {
        return new UsageResponse(
            TransactionResponse.from(result.getTransaction()),
            GiftCardResponse.from(result.getGiftCard()));
    }
}

package com.flagship.gift_card_ledger.giftcard.dto;

import com.flagship.gift_card_ledger.commission.dto.CommissionResponse;
import com.flagship.gift_card_ledger.giftcard.RechargeResult;
import lombok.Value;

@Value
public class RechargeResponse {
    TransactionResponse transaction;
    GiftCardResponse giftCard;
    CommissionResponse commission;

    public static RechargeResponse from(RechargeResult result) {
        return new RechargeResponse(
            TransactionResponse.from(result.getTransaction()),
            GiftCardResponse.from(result.getGiftCard()),
            CommissionResponse.fromDomain(result.getCommission()));
    }
}

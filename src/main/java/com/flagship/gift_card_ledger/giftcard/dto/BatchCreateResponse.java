package com.flagship.gift_card_ledger.giftcard.dto;

import com.flagship.gift_card_ledger.giftcard.BatchIssueResult;
import lombok.Value;

import java.util.List;

@Value
public class BatchCreateResponse {
    int quantity;
    int createdCount;
    List<GiftCardResponse> giftCards;
    List<String> failures;

    public static BatchCreateResponse from(BatchIssueResult result) {
        return new BatchCreateResponse(
            result.getQuantity(),
            result.getCreatedCount(),
            result.getCreated().stream()
                .map(issued -> GiftCardResponse.from(issued.getGiftCard(), issued.getQrCode()))
                .toList(),
            result.getFailures());
    }
}

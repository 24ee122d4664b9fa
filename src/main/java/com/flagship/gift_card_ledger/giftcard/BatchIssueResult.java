package com.flagship.gift_card_ledger.giftcard;

import lombok.Value;

import java.util.List;

/**
 * Outcome of a batch creation. Cards are created independently, so
 * {@code createdCount} may be lower than {@code quantity}.
 */
@Value
public class BatchIssueResult {
    int quantity;
    int createdCount;
    List<IssuedGiftCard> created;
    List<String> failures;

    public boolean isComplete() {
        return createdCount == quantity;
    }
}

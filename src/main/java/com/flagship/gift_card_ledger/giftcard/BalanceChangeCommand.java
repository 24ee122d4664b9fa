package com.flagship.gift_card_ledger.giftcard;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Input of {@link LedgerStore#applyBalanceChange(BalanceChangeCommand)}.
 * {@code delta} is signed: positive for credits, negative for usage.
 */
@Value
@Builder
public class BalanceChangeCommand {
    UUID giftCardId;
    UUID establishmentId;
    BigDecimal delta;
    TransactionType type;
    String description;
    Map<String, Object> metadata;
    String idempotencyKey;
}

package com.flagship.gift_card_ledger.giftcard;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One append-only entry in a card's balance history.
 *
 * {@code sequenceNumber} is assigned by the database and orders the chain:
 * each entry's {@code balanceBefore} equals the previous entry's
 * {@code balanceAfter}.
 */
@Value
public class GiftCardTransaction {
    UUID id;
    UUID giftCardId;
    UUID establishmentId;
    TransactionType type;
    BigDecimal amount;
    BigDecimal balanceBefore;
    BigDecimal balanceAfter;
    String description;
    Map<String, Object> metadata;
    Long sequenceNumber;
    Instant createdAt;

    public static final String METADATA_COMMISSION_RATE = "commissionRate";
    public static final String METADATA_ACTOR = "actor";
    public static final String METADATA_CORRELATION_ID = "correlationId";

    /**
     * Reads the commission rate captured when a recharge was applied.
     */
    public BigDecimal commissionRateSnapshot() {
        Object rate = metadata == null ? null : metadata.get(METADATA_COMMISSION_RATE);
        return rate == null ? null : new BigDecimal(rate.toString());
    }
}

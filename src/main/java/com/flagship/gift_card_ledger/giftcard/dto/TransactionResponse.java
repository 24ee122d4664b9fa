package com.flagship.gift_card_ledger.giftcard.dto;

import com.flagship.gift_card_ledger.giftcard.GiftCardTransaction;
import com.flagship.gift_card_ledger.giftcard.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {
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

    public static TransactionResponse from(GiftCardTransaction tx) {
        return TransactionResponse.builder()
            .id(tx.getId())
            .giftCardId(tx.getGiftCardId())
            .establishmentId(tx.getEstablishmentId())
            .type(tx.getType())
            .amount(tx.getAmount())
            .balanceBefore(tx.getBalanceBefore())
            .balanceAfter(tx.getBalanceAfter())
            .description(tx.getDescription())
            .metadata(tx.getMetadata())
            .sequenceNumber(tx.getSequenceNumber())
            .createdAt(tx.getCreatedAt())
            .build();
    }
}

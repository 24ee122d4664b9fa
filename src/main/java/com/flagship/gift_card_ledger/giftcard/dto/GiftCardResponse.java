package com.flagship.gift_card_ledger.giftcard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.gift_card_ledger.giftcard.GiftCard;
import com.flagship.gift_card_ledger.giftcard.GiftCardStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GiftCardResponse {
    UUID id;
    String code;
    UUID franchiseId;
    UUID establishmentId;
    BigDecimal initialValue;
    BigDecimal currentBalance;
    GiftCardStatus status;
    Instant validUntil;
    String qrCode;
    Instant createdAt;
    Instant updatedAt;

    public static GiftCardResponse from(GiftCard card) {
        return from(card, null);
    }

    public static GiftCardResponse from(GiftCard card, String qrCode) {
        return GiftCardResponse.builder()
            .id(card.getId())
            .code(card.getCode())
            .franchiseId(card.getFranchiseId())
            .establishmentId(card.getEstablishmentId())
            .initialValue(card.getInitialValue())
            .currentBalance(card.getCurrentBalance())
            .status(card.getStatus())
            .validUntil(card.getValidUntil())
            .qrCode(qrCode)
            .createdAt(card.getCreatedAt())
            .updatedAt(card.getUpdatedAt())
            .build();
    }
}

package com.flagship.gift_card_ledger.giftcard.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class CancelGiftCardRequest {

    @NotNull(message = "Establishment ID is required")
    UUID establishmentId;
}

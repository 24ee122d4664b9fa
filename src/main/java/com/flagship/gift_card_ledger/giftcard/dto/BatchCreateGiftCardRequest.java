package com.flagship.gift_card_ledger.giftcard.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class BatchCreateGiftCardRequest {

    @NotNull(message = "Franchise ID is required")
    UUID franchiseId;

    @NotNull(message = "Establishment ID is required")
    UUID establishmentId;

    @NotNull(message = "Value is required")
    @DecimalMin(value = "0.01", message = "Value must be greater than 0")
    BigDecimal value;

    Instant validUntil;

    @NotNull(message = "Quantity is required")
    @Min(value = 1, message = "Quantity must be at least 1")
    @Max(value = 100, message = "Quantity must be at most 100")
    Integer quantity;
}

package com.flagship.gift_card_ledger.giftcard.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Body of a recharge or usage request.
 */
@Value
public class BalanceOperationRequest {

    @NotNull(message = "Establishment ID is required")
    UUID establishmentId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    BigDecimal amount;

    @Size(max = 255, message = "Description must be at most 255 characters")
    String description;
}

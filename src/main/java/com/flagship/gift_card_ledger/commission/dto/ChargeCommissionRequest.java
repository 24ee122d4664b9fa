package com.flagship.gift_card_ledger.commission.dto;

import com.flagship.gift_card_ledger.gateway.PaymentMethod;
import jakarta.validation.constraints.FutureOrPresent;
import lombok.Value;

import java.time.LocalDate;

/**
 * Body of a manual charge request. Every field is optional; method and due
 * date fall back to the configured defaults.
 */
@Value
public class ChargeCommissionRequest {
    PaymentMethod paymentMethod;

    @FutureOrPresent(message = "Due date cannot be in the past")
    LocalDate dueDate;

    String creditCardToken;
}

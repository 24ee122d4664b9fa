package com.flagship.gift_card_ledger.gateway;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class ChargeRequest {
    String customerRef;
    PaymentMethod method;
    BigDecimal value;
    LocalDate dueDate;
    String description;
    String externalReference;
    @ToString.Exclude
    String creditCardToken;
}

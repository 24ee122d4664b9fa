package com.flagship.gift_card_ledger.gateway;

import lombok.Value;

/**
 * Data the gateway needs to register a paying customer.
 * {@code externalReference} is the establishment id.
 */
@Value
public class CustomerProfile {
    String name;
    String document;
    String email;
    String phone;
    String externalReference;
}

package com.flagship.gift_card_ledger.gateway;

import lombok.Value;

/**
 * What the gateway returns for a created charge: its reference and where the
 * payer can settle it.
 */
@Value
public class ChargeResult {
    String chargeRef;
    String status;
    String invoiceUrl;
    String bankSlipUrl;
}

package com.flagship.gift_card_ledger.commission.dto;

import lombok.Value;

@Value
public class ChargeCommissionResponse {
    CommissionResponse commission;
    String chargeStatus;
    String bankSlipUrl;
}

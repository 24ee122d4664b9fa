package com.flagship.gift_card_ledger.gateway;

/**
 * Outbound contract with the payment provider.
 *
 * Implementations translate provider failures (rejections, timeouts,
 * transport errors) into {@link com.flagship.gift_card_ledger.exception.GatewayException}.
 */
public interface PaymentGatewayClient {

    /**
     * Registers a customer and returns the provider's reference for it.
     */
    String createCustomer(CustomerProfile profile);

    ChargeResult createCharge(ChargeRequest request);

    /**
     * Deletes a charge that will not be tracked, so the payer cannot settle it.
     */
    void cancelCharge(String chargeRef);
}

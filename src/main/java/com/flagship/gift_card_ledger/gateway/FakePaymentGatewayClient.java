package com.flagship.gift_card_ledger.gateway;

import com.flagship.gift_card_ledger.exception.GatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process gateway for local runs and tests.
 *
 * Deterministic: customer references derive from the establishment id, and a
 * card charge with token {@value #DECLINED_TOKEN} is rejected.
 */
@Component
@ConditionalOnProperty(name = "gateway.provider", havingValue = "fake", matchIfMissing = true)
@Slf4j
public class FakePaymentGatewayClient implements PaymentGatewayClient {

    public static final String DECLINED_TOKEN = "tok_declined";

    private final Set<String> cancelledCharges = ConcurrentHashMap.newKeySet();

    @Override
    public String createCustomer(CustomerProfile profile) {
        String ref = "cus_fake_" + UUID.nameUUIDFromBytes(
                profile.getExternalReference().getBytes(StandardCharsets.UTF_8)).toString().substring(0, 12);
        log.info("[fake gateway] registered customer {} for {}", ref, profile.getExternalReference());
        return ref;
    }

    @Override
    public ChargeResult createCharge(ChargeRequest request) {
        if (request.getMethod().requiresCardToken() && DECLINED_TOKEN.equals(request.getCreditCardToken())) {
            throw new GatewayException("Card declined by issuer");
        }
        String chargeRef = "pay_fake_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        log.info("[fake gateway] created {} charge {} of {} for {}",
                request.getMethod(), chargeRef, request.getValue(), request.getExternalReference());
        return new ChargeResult(
                chargeRef,
                "PENDING",
                "https://fake-gateway.local/i/" + chargeRef,
                request.getMethod() == PaymentMethod.BOLETO ? "https://fake-gateway.local/b/" + chargeRef : null);
    }

    @Override
    public void cancelCharge(String chargeRef) {
        cancelledCharges.add(chargeRef);
        log.info("[fake gateway] deleted charge {}", chargeRef);
    }

    public boolean isCancelled(String chargeRef) {
        return cancelledCharges.contains(chargeRef);
    }
}

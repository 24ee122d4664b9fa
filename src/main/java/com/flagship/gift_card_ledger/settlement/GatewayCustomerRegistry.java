package com.flagship.gift_card_ledger.settlement;

import com.flagship.gift_card_ledger.directory.EstablishmentProfile;
import com.flagship.gift_card_ledger.gateway.CustomerProfile;
import com.flagship.gift_card_ledger.gateway.PaymentGatewayClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Resolves the gateway customer for an establishment, registering it with the
 * gateway on first use.
 *
 * Two workers may register the same establishment concurrently. The first
 * insert wins and the loser adopts the stored reference; the surplus gateway
 * customer stays unused.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GatewayCustomerRegistry {

    private final GatewayCustomerRepository repository;
    private final PaymentGatewayClient gateway;

    public String ensureCustomer(EstablishmentProfile establishment) {
        return repository.findById(establishment.getId())
            .map(GatewayCustomerEntity::getCustomerRef)
            .orElseGet(() -> register(establishment));
    }

    private String register(EstablishmentProfile establishment) {
        String customerRef = gateway.createCustomer(new CustomerProfile(
            establishment.getName(),
            establishment.getDocument(),
            establishment.getEmail(),
            establishment.getPhone(),
            establishment.getId().toString()
        ));
        try {
            repository.saveAndFlush(GatewayCustomerEntity.of(establishment.getId(), customerRef));
            log.info("Stored gateway customer {} for establishment {}", customerRef, establishment.getId());
            return customerRef;
        } catch (DataIntegrityViolationException e) {
            String winner = repository.findById(establishment.getId())
                .map(GatewayCustomerEntity::getCustomerRef)
                .orElseThrow(() -> e);
            log.warn("Establishment {} was registered concurrently; using {} instead of {}",
                establishment.getId(), winner, customerRef);
            return winner;
        }
    }
}

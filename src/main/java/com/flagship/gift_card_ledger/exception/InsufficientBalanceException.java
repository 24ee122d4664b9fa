package com.flagship.gift_card_ledger.exception;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A usage asked for more than the card holds.
 */
public class InsufficientBalanceException extends GiftCardPlatformException {

    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientBalanceException(BigDecimal available, BigDecimal requested) {
        super(ErrorKind.INSUFFICIENT_BALANCE,
                String.format("Insufficient balance: available=%s, requested=%s", available, requested),
                Map.of("available", available, "requested", requested));
        this.available = available;
        this.requested = requested;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public BigDecimal getRequested() {
        return requested;
    }
}

package com.flagship.gift_card_ledger.commission;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Commission amount for a recharge: {@code amount * rate / 100}, rounded
 * half-up to cents.
 */
public final class CommissionCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private CommissionCalculator() {
    }

    public static BigDecimal commissionFor(BigDecimal rechargeAmount, BigDecimal ratePercent) {
        if (rechargeAmount == null || ratePercent == null) {
            throw new IllegalArgumentException("Recharge amount and rate are required");
        }
        if (ratePercent.signum() < 0 || ratePercent.compareTo(HUNDRED) > 0) {
            throw new IllegalArgumentException("Commission rate must be between 0 and 100: " + ratePercent);
        }
        return rechargeAmount.multiply(ratePercent)
            .divide(HUNDRED, 2, RoundingMode.HALF_UP);
    }
}

package com.flagship.gift_card_ledger.job;

import com.flagship.gift_card_ledger.gateway.PaymentMethod;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Request to create a gateway charge for a commission.
 * Method and due date fall back to the configured defaults when absent.
 */
@Value
public class CommissionChargeJob {
    UUID jobId;
    UUID commissionId;
    PaymentMethod paymentMethod;
    LocalDate dueDate;
    Instant enqueuedAt;

    public static CommissionChargeJob forCommission(UUID commissionId) {
        return new CommissionChargeJob(UUID.randomUUID(), commissionId, null, null, Instant.now());
    }
}

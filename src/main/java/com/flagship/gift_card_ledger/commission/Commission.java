package com.flagship.gift_card_ledger.commission;

import com.flagship.gift_card_ledger.gateway.PaymentMethod;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Commission owed by an establishment to its franchise for one recharge.
 *
 * Immutable. Every status change goes through
 * {@link CommissionStateMachine#requireMove}, so an instance can only be
 * produced in a status the table allows. {@code externalReference} is the
 * commission id as sent to the gateway and never changes.
 *
 * {@code chargeAttemptId} is set while a gateway charge is in flight. It is
 * cleared when that attempt records its outcome, and an outcome carrying any
 * other attempt id is not applied.
 */
@Value
@Builder(toBuilder = true, access = AccessLevel.PRIVATE)
public class Commission {
    UUID id;
    UUID franchiseId;
    UUID establishmentId;
    UUID transactionId;
    BigDecimal amount;
    BigDecimal commissionRate;
    CommissionStatus status;
    CommissionFailureReason failureReason;
    String lastError;
    String externalReference;
    String gatewayChargeId;
    PaymentMethod paymentMethod;
    LocalDate dueDate;
    String invoiceUrl;
    int chargeAttempts;
    UUID chargeAttemptId;
    Instant chargeClaimedAt;
    Instant paidAt;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a PENDING commission for a recharge transaction.
     */
    public static Commission pending(UUID id, UUID franchiseId, UUID establishmentId, UUID transactionId,
                                     BigDecimal amount, BigDecimal commissionRate) {
        Instant now = Instant.now();
        return Commission.builder()
            .id(id)
            .franchiseId(franchiseId)
            .establishmentId(establishmentId)
            .transactionId(transactionId)
            .amount(amount)
            .commissionRate(commissionRate)
            .status(CommissionStatus.PENDING)
            .externalReference(id.toString())
            .chargeAttempts(0)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Records a charge accepted by the gateway. Clears any earlier failure.
     */
    public Commission markCharged(String chargeRef, PaymentMethod method, LocalDate dueDate, String invoiceUrl) {
        CommissionStatus next = CommissionStateMachine.requireMove(status, CommissionEvent.CHARGE_CREATED);
        return toBuilder()
            .status(next)
            .gatewayChargeId(chargeRef)
            .paymentMethod(method)
            .dueDate(dueDate)
            .invoiceUrl(invoiceUrl)
            .chargeAttempts(chargeAttempts + 1)
            .chargeAttemptId(null)
            .chargeClaimedAt(null)
            .failureReason(null)
            .lastError(null)
            .updatedAt(Instant.now())
            .build();
    }

    public Commission markChargeRejected(String error) {
        return fail(CommissionEvent.CHARGE_REJECTED, CommissionFailureReason.CHARGE_REJECTED, error)
            .toBuilder()
            .chargeAttempts(chargeAttempts + 1)
            .chargeAttemptId(null)
            .chargeClaimedAt(null)
            .build();
    }

    /**
     * Reserves the commission for one gateway charge attempt. Status is unchanged.
     */
    public Commission claimCharge(UUID attemptId, Instant claimedAt) {
        return toBuilder()
            .chargeAttemptId(attemptId)
            .chargeClaimedAt(claimedAt)
            .updatedAt(claimedAt)
            .build();
    }

    /**
     * Drops the claim of an attempt that ended without a gateway outcome.
     */
    public Commission releaseChargeClaim() {
        return toBuilder()
            .chargeAttemptId(null)
            .chargeClaimedAt(null)
            .updatedAt(Instant.now())
            .build();
    }

    public boolean hasChargeInFlight() {
        return chargeAttemptId != null;
    }

    /**
     * An in-flight claim taken at or after {@code cutoff} still blocks other attempts.
     */
    public boolean hasLiveChargeClaim(Instant cutoff) {
        return chargeAttemptId != null && chargeClaimedAt != null && !chargeClaimedAt.isBefore(cutoff);
    }

    public Commission markRetriesExhausted(String error) {
        return fail(CommissionEvent.CHARGE_RETRIES_EXHAUSTED, CommissionFailureReason.CHARGE_RETRIES_EXHAUSTED, error);
    }

    public Commission markPaid(Instant paidAt) {
        CommissionStatus next = CommissionStateMachine.requireMove(status, CommissionEvent.PAYMENT_CONFIRMED);
        return toBuilder()
            .status(next)
            .paidAt(paidAt != null ? paidAt : Instant.now())
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * Records that the gateway cancelled the charge (deleted) or returned the money (refunded).
     */
    public Commission markCancelledByGateway(CommissionEvent event) {
        CommissionFailureReason reason = switch (event) {
            case PAYMENT_DELETED -> CommissionFailureReason.PAYMENT_DELETED;
            case PAYMENT_REFUNDED -> CommissionFailureReason.PAYMENT_REFUNDED;
            default -> throw new IllegalArgumentException("Not a gateway cancellation: " + event);
        };
        return fail(event, reason, null);
    }

    /**
     * A charge job should act on this commission: it has no charge yet, or its
     * last charge was rejected by the gateway.
     */
    public boolean isAwaitingCharge() {
        return status == CommissionStatus.PENDING
            || (status == CommissionStatus.FAILED && failureReason != null && failureReason.isRetryable());
    }

    private Commission fail(CommissionEvent event, CommissionFailureReason reason, String error) {
        CommissionStatus next = CommissionStateMachine.requireMove(status, event);
        return toBuilder()
            .status(next)
            .failureReason(reason)
            .lastError(error)
            .updatedAt(Instant.now())
            .build();
    }
}

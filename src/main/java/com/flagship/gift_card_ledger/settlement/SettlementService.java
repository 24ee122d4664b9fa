package com.flagship.gift_card_ledger.settlement;

import com.flagship.gift_card_ledger.commission.Commission;
import com.flagship.gift_card_ledger.commission.CommissionEvent;
import com.flagship.gift_card_ledger.commission.CommissionStateStore;
import com.flagship.gift_card_ledger.commission.CommissionStatus;
import com.flagship.gift_card_ledger.directory.EstablishmentDirectory;
import com.flagship.gift_card_ledger.directory.EstablishmentProfile;
import com.flagship.gift_card_ledger.exception.ConflictException;
import com.flagship.gift_card_ledger.exception.GatewayException;
import com.flagship.gift_card_ledger.exception.InvalidOperationException;
import com.flagship.gift_card_ledger.exception.NotFoundException;
import com.flagship.gift_card_ledger.exception.ValidationException;
import com.flagship.gift_card_ledger.gateway.ChargeRequest;
import com.flagship.gift_card_ledger.gateway.ChargeResult;
import com.flagship.gift_card_ledger.gateway.PaymentGatewayClient;
import com.flagship.gift_card_ledger.gateway.PaymentMethod;
import com.flagship.gift_card_ledger.job.PaymentWebhookJob;
import com.flagship.gift_card_ledger.observability.CorrelationIdFilter;
import com.flagship.gift_card_ledger.observability.GiftCardMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives commissions through settlement: creating gateway charges and
 * applying the gateway's payment notifications.
 *
 * Not transactional itself. Gateway calls happen outside any database
 * transaction; each resulting state change is its own short locked
 * transaction in {@link CommissionStateStore}.
 */
@Service
@Slf4j
public class SettlementService {

    private final CommissionStateStore stateStore;
    private final EstablishmentDirectory directory;
    private final GatewayCustomerRegistry customerRegistry;
    private final PaymentGatewayClient gateway;
    private final GiftCardMetrics metrics;
    private final PaymentMethod defaultMethod;
    private final int defaultDueDays;
    private final Duration claimTimeout;

    public SettlementService(CommissionStateStore stateStore,
                             EstablishmentDirectory directory,
                             GatewayCustomerRegistry customerRegistry,
                             PaymentGatewayClient gateway,
                             GiftCardMetrics metrics,
                             @Value("${commission.charge.default-method:PIX}") PaymentMethod defaultMethod,
                             @Value("${commission.charge.default-due-days:3}") int defaultDueDays,
                             @Value("${commission.charge.claim-timeout-seconds:120}") long claimTimeoutSeconds) {
        this.stateStore = stateStore;
        this.directory = directory;
        this.customerRegistry = customerRegistry;
        this.gateway = gateway;
        this.metrics = metrics;
        this.defaultMethod = defaultMethod;
        this.defaultDueDays = defaultDueDays;
        this.claimTimeout = Duration.ofSeconds(claimTimeoutSeconds);
    }

    /**
     * Creates a gateway charge for a PENDING or FAILED commission.
     *
     * The commission is claimed under its row lock before the gateway is
     * called, so concurrent callers (a manual charge and a charge job) cannot
     * both create a charge. The outcome is recorded only while this attempt
     * still holds the claim; a charge created by an attempt that lost its
     * claim is deleted at the gateway.
     *
     * @param method          payment method, or null for the configured default
     * @param dueDate         due date, or null for today plus the configured days
     * @param creditCardToken required for {@link PaymentMethod#CREDIT_CARD}
     * @return the CHARGED commission and the gateway's charge
     * @throws InvalidOperationException if the commission is CHARGED or PAID
     * @throws ConflictException if another charge attempt is in flight, or
     *         this attempt's claim was taken over
     * @throws GatewayException if the gateway refused; the commission is then
     *         FAILED with reason CHARGE_REJECTED
     */
    public ChargeOutcome requestCharge(UUID commissionId, PaymentMethod method, LocalDate dueDate,
                                       String creditCardToken) {
        Commission commission = stateStore.findById(commissionId)
            .orElseThrow(() -> new NotFoundException("Commission", commissionId));

        PaymentMethod chargeMethod = method != null ? method : defaultMethod;
        LocalDate chargeDueDate = dueDate != null ? dueDate : LocalDate.now().plusDays(defaultDueDays);
        if (chargeMethod.requiresCardToken() && (creditCardToken == null || creditCardToken.isBlank())) {
            throw new ValidationException("A credit card token is required for CREDIT_CARD charges",
                Map.of("paymentMethod", chargeMethod.name()));
        }
        if (chargeDueDate.isBefore(LocalDate.now())) {
            throw new ValidationException("Due date cannot be in the past",
                Map.of("dueDate", chargeDueDate.toString()));
        }

        MDC.put(CorrelationIdFilter.COMMISSION_ID_MDC_KEY, commissionId.toString());
        try {
            UUID attemptId = UUID.randomUUID();
            stateStore.claimCharge(commissionId, attemptId, claimTimeout);

            ChargeResult result;
            try {
                EstablishmentProfile establishment = directory.getEstablishment(commission.getEstablishmentId());
                String customerRef = customerRegistry.ensureCustomer(establishment);
                result = gateway.createCharge(ChargeRequest.builder()
                    .customerRef(customerRef)
                    .method(chargeMethod)
                    .value(commission.getAmount())
                    .dueDate(chargeDueDate)
                    .description("Gift card recharge commission " + commission.getExternalReference())
                    .externalReference(commission.getExternalReference())
                    .creditCardToken(creditCardToken)
                    .build());
            } catch (GatewayException e) {
                log.warn("Gateway rejected charge for commission {}: {}", commissionId, e.getMessage());
                stateStore.applyChargeOutcome(commissionId, attemptId, CommissionEvent.CHARGE_REJECTED,
                    current -> current.markChargeRejected(e.getMessage()));
                throw e;
            } catch (RuntimeException e) {
                try {
                    stateStore.releaseChargeClaim(commissionId, attemptId);
                } catch (RuntimeException releaseFailure) {
                    e.addSuppressed(releaseFailure);
                }
                throw e;
            }

            ChargeResult charge = result;
            CommissionStateStore.TransitionResult transition = stateStore.applyChargeOutcome(commissionId,
                attemptId, CommissionEvent.CHARGE_CREATED,
                current -> current.markCharged(charge.getChargeRef(), chargeMethod, chargeDueDate,
                    charge.getInvoiceUrl()));
            if (!transition.moved()) {
                cancelOrphanedCharge(commissionId, charge.getChargeRef());
                throw new ConflictException(
                    String.format("Charge attempt for commission %s was superseded", commissionId),
                    Map.of("commissionId", commissionId.toString(), "chargeRef", charge.getChargeRef()));
            }

            log.info("Commission {} charged via {}: charge {} due {}",
                commissionId, chargeMethod, charge.getChargeRef(), chargeDueDate);
            return new ChargeOutcome(transition.commission(), charge);
        } finally {
            MDC.remove(CorrelationIdFilter.COMMISSION_ID_MDC_KEY);
        }
    }

    /**
     * Applies a gateway notification to its commission.
     *
     * Never fails on stale, duplicate or unknown notifications: those are
     * logged and dropped so the gateway is not asked to redeliver them.
     *
     * @throws ConflictException if a payment arrives for a commission whose
     *         charge is not recorded yet; the job is retried with backoff
     */
    public void applyWebhookEvent(PaymentWebhookJob job) {
        PaymentEventKind kind = PaymentEventKind.fromGatewayCode(job.getEventCode());
        Optional<Commission> target = resolveCommission(job);
        if (target.isEmpty()) {
            log.warn("No commission for gateway event {} (charge={}, reference={}), dropping",
                job.getEventCode(), job.getChargeRef(), job.getExternalReference());
            return;
        }
        Commission commission = target.get();
        UUID commissionId = commission.getId();

        MDC.put(CorrelationIdFilter.COMMISSION_ID_MDC_KEY, commissionId.toString());
        try {
            switch (kind) {
                case CONFIRMED, RECEIVED -> {
                    if (commission.getStatus() == CommissionStatus.PENDING
                            || commission.hasLiveChargeClaim(Instant.now().minus(claimTimeout))) {
                        throw new ConflictException(
                            String.format("Payment for commission %s arrived before its charge was recorded",
                                commissionId),
                            Map.of("commissionId", commissionId.toString(),
                                   "status", commission.getStatus().name(),
                                   "chargeRef", String.valueOf(job.getChargeRef())));
                    }
                    stateStore.apply(commissionId, CommissionEvent.PAYMENT_CONFIRMED,
                        current -> current.markPaid(job.getPaymentConfirmedAt()));
                }
                case OVERDUE -> {
                    metrics.recordOverdueNotification();
                    log.warn("Commission {} charge {} is overdue (due {})",
                        commissionId, commission.getGatewayChargeId(), commission.getDueDate());
                }
                case DELETED -> stateStore.apply(commissionId, CommissionEvent.PAYMENT_DELETED,
                    current -> current.markCancelledByGateway(CommissionEvent.PAYMENT_DELETED));
                case REFUNDED -> {
                    if (commission.getStatus() == CommissionStatus.PAID) {
                        log.warn("Refund received for PAID commission {} (charge {}); refunds of settled "
                            + "commissions are not handled", commissionId, job.getChargeRef());
                    } else {
                        stateStore.apply(commissionId, CommissionEvent.PAYMENT_REFUNDED,
                            current -> current.markCancelledByGateway(CommissionEvent.PAYMENT_REFUNDED));
                    }
                }
                case UNRECOGNIZED -> log.info("Unrecognized gateway event {} for commission {}, ignoring",
                    job.getEventCode(), commissionId);
            }
        } finally {
            MDC.remove(CorrelationIdFilter.COMMISSION_ID_MDC_KEY);
        }
    }

    /**
     * Marks a commission FAILED after its charge job used up every attempt.
     * Ignored when a concurrent path already charged it.
     */
    public void markChargeRetriesExhausted(UUID commissionId, String lastError) {
        stateStore.apply(commissionId, CommissionEvent.CHARGE_RETRIES_EXHAUSTED,
            current -> current.markRetriesExhausted(lastError));
    }

    private void cancelOrphanedCharge(UUID commissionId, String chargeRef) {
        log.warn("Charge {} for commission {} lost its claim, deleting it at the gateway", chargeRef, commissionId);
        try {
            gateway.cancelCharge(chargeRef);
        } catch (GatewayException e) {
            metrics.recordOrphanedCharge();
            log.error("Could not delete orphaned charge {} of commission {}; it must be cancelled manually: {}",
                chargeRef, commissionId, e.getMessage());
        }
    }

    /**
     * Finds the commission by gateway charge id, falling back to the external
     * reference for notifications that arrive before the charge id is stored.
     * A notification for an older charge of a re-charged commission is stale.
     */
    private Optional<Commission> resolveCommission(PaymentWebhookJob job) {
        if (job.getChargeRef() != null) {
            Optional<Commission> byCharge = stateStore.findByGatewayChargeId(job.getChargeRef());
            if (byCharge.isPresent()) {
                return byCharge;
            }
        }
        if (job.getExternalReference() == null) {
            return Optional.empty();
        }
        return stateStore.findByExternalReference(job.getExternalReference())
            .filter(commission -> {
                boolean stale = job.getChargeRef() != null
                    && commission.getGatewayChargeId() != null
                    && !commission.getGatewayChargeId().equals(job.getChargeRef());
                if (stale) {
                    log.info("Event {} refers to superseded charge {} of commission {} (current {})",
                        job.getEventCode(), job.getChargeRef(), commission.getId(), commission.getGatewayChargeId());
                }
                return !stale;
            });
    }

    /**
     * A successfully created charge and the commission it moved to CHARGED.
     */
    public record ChargeOutcome(Commission commission, ChargeResult charge) {
    }
}

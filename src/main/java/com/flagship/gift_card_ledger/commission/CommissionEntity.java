package com.flagship.gift_card_ledger.commission;

import com.flagship.gift_card_ledger.gateway.PaymentMethod;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for commissions.
 *
 * No setters: rows are created through {@link #fromDomain(Commission)} and
 * changed only through {@link #updateFromDomain(Commission)}, which copies the
 * settlement fields. Identity, amounts and the external reference are fixed at
 * creation.
 */
@Entity
@Table(name = "commissions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CommissionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "franchise_id", nullable = false, updatable = false)
    private UUID franchiseId;

    @Column(name = "establishment_id", nullable = false, updatable = false)
    private UUID establishmentId;

    @Column(name = "transaction_id", nullable = false, updatable = false, unique = true)
    private UUID transactionId;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "commission_rate", nullable = false, updatable = false, precision = 5, scale = 2)
    private BigDecimal commissionRate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CommissionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", length = 50)
    private CommissionFailureReason failureReason;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "external_reference", nullable = false, updatable = false, unique = true, length = 64)
    private String externalReference;

    @Column(name = "gateway_charge_id", unique = true, length = 100)
    private String gatewayChargeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", length = 20)
    private PaymentMethod paymentMethod;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @Column(name = "invoice_url", columnDefinition = "TEXT")
    private String invoiceUrl;

    @Column(name = "charge_attempts", nullable = false)
    private int chargeAttempts;

    @Column(name = "charge_attempt_id")
    private UUID chargeAttemptId;

    @Column(name = "charge_claimed_at")
    private Instant chargeClaimedAt;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static CommissionEntity fromDomain(Commission commission) {
        return new CommissionEntity(
            commission.getId(),
            commission.getFranchiseId(),
            commission.getEstablishmentId(),
            commission.getTransactionId(),
            commission.getAmount(),
            commission.getCommissionRate(),
            commission.getStatus(),
            commission.getFailureReason(),
            commission.getLastError(),
            commission.getExternalReference(),
            commission.getGatewayChargeId(),
            commission.getPaymentMethod(),
            commission.getDueDate(),
            commission.getInvoiceUrl(),
            commission.getChargeAttempts(),
            commission.getChargeAttemptId(),
            commission.getChargeClaimedAt(),
            commission.getPaidAt(),
            commission.getCreatedAt(),
            null // updatedAt - set by @PrePersist
        );
    }

    public Commission toDomain() {
        return new Commission(
            id,
            franchiseId,
            establishmentId,
            transactionId,
            amount,
            commissionRate,
            status,
            failureReason,
            lastError,
            externalReference,
            gatewayChargeId,
            paymentMethod,
            dueDate,
            invoiceUrl,
            chargeAttempts,
            chargeAttemptId,
            chargeClaimedAt,
            paidAt,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the settlement fields. Everything else is immutable after creation.
     */
    void updateFromDomain(Commission commission) {
        this.status = commission.getStatus();
        this.failureReason = commission.getFailureReason();
        this.lastError = commission.getLastError();
        this.gatewayChargeId = commission.getGatewayChargeId();
        this.paymentMethod = commission.getPaymentMethod();
        this.dueDate = commission.getDueDate();
        this.invoiceUrl = commission.getInvoiceUrl();
        this.chargeAttempts = commission.getChargeAttempts();
        this.chargeAttemptId = commission.getChargeAttemptId();
        this.chargeClaimedAt = commission.getChargeClaimedAt();
        this.paidAt = commission.getPaidAt();
    }
}

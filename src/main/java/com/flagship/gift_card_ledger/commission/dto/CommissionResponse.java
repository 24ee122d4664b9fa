package com.flagship.gift_card_ledger.commission.dto;

import com.flagship.gift_card_ledger.commission.Commission;
import com.flagship.gift_card_ledger.commission.CommissionFailureReason;
import com.flagship.gift_card_ledger.commission.CommissionStatus;
import com.flagship.gift_card_ledger.gateway.PaymentMethod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class CommissionResponse {
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
    Instant paidAt;
    Instant createdAt;
    Instant updatedAt;

    public static CommissionResponse fromDomain(Commission commission) {
        if (commission == null) {
            return null;
        }
        return CommissionResponse.builder()
            .id(commission.getId())
            .franchiseId(commission.getFranchiseId())
            .establishmentId(commission.getEstablishmentId())
            .transactionId(commission.getTransactionId())
            .amount(commission.getAmount())
            .commissionRate(commission.getCommissionRate())
            .status(commission.getStatus())
            .failureReason(commission.getFailureReason())
            .lastError(commission.getLastError())
            .externalReference(commission.getExternalReference())
            .gatewayChargeId(commission.getGatewayChargeId())
            .paymentMethod(commission.getPaymentMethod())
            .dueDate(commission.getDueDate())
            .invoiceUrl(commission.getInvoiceUrl())
            .chargeAttempts(commission.getChargeAttempts())
            .paidAt(commission.getPaidAt())
            .createdAt(commission.getCreatedAt())
            .updatedAt(commission.getUpdatedAt())
            .build();
    }
}

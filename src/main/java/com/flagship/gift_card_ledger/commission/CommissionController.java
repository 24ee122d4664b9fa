package com.flagship.gift_card_ledger.commission;

import com.flagship.gift_card_ledger.commission.dto.ChargeCommissionRequest;
import com.flagship.gift_card_ledger.commission.dto.ChargeCommissionResponse;
import com.flagship.gift_card_ledger.commission.dto.CommissionResponse;
import com.flagship.gift_card_ledger.settlement.SettlementService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Commission reads and manual charge requests.
 */
@RestController
@RequestMapping("/api/v1/commissions")
@RequiredArgsConstructor
@Slf4j
public class CommissionController {

    private final CommissionService commissionService;
    private final SettlementService settlementService;

    @GetMapping("/{id}")
    public ResponseEntity<CommissionResponse> getCommission(@PathVariable UUID id) {
        return ResponseEntity.ok(CommissionResponse.fromDomain(commissionService.get(id)));
    }

    @GetMapping
    public ResponseEntity<List<CommissionResponse>> listCommissions(
            @RequestParam(required = false) CommissionStatus status,
            @RequestParam(required = false) UUID establishmentId) {
        List<CommissionResponse> commissions = commissionService.list(status, establishmentId).stream()
            .map(CommissionResponse::fromDomain)
            .toList();
        return ResponseEntity.ok(commissions);
    }

    /**
     * Creates a gateway charge now instead of waiting for the queued job.
     * Allowed for PENDING and FAILED commissions.
     */
    @PostMapping("/{id}/charge")
    public ResponseEntity<ChargeCommissionResponse> charge(
            @PathVariable UUID id,
            @Valid @RequestBody(required = false) ChargeCommissionRequest request) {
        log.info("Manual charge requested for commission {}", id);
        SettlementService.ChargeOutcome outcome = request == null
            ? settlementService.requestCharge(id, null, null, null)
            : settlementService.requestCharge(id, request.getPaymentMethod(), request.getDueDate(),
                request.getCreditCardToken());
        return ResponseEntity.ok(new ChargeCommissionResponse(
            CommissionResponse.fromDomain(outcome.commission()),
            outcome.charge().getStatus(),
            outcome.charge().getBankSlipUrl()));
    }
}

package com.flagship.gift_card_ledger.commission;

import com.flagship.gift_card_ledger.exception.NotFoundException;
import com.flagship.gift_card_ledger.giftcard.GiftCardTransaction;
import com.flagship.gift_card_ledger.giftcard.TransactionType;
import com.flagship.gift_card_ledger.job.CommissionChargeJob;
import com.flagship.gift_card_ledger.job.JobKind;
import com.flagship.gift_card_ledger.job.JobQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates commissions for recharges and serves commission reads.
 *
 * The commission row and its charge job are written in one transaction, so a
 * commission is never left without a queued charge.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommissionService {

    private final CommissionRepository repository;
    private final JobQueue jobQueue;

    /**
     * Creates the PENDING commission for a recharge and enqueues its charge.
     *
     * Idempotent per transaction: a second call for the same recharge returns
     * the commission created by the first.
     *
     * @param recharge   the committed recharge transaction
     * @param franchiseId franchise receiving the commission
     * @param ratePercent rate snapshot taken when the recharge was applied
     */
    @Transactional
    public Commission createPendingForRecharge(GiftCardTransaction recharge, UUID franchiseId,
                                               BigDecimal ratePercent) {
        if (recharge.getType() != TransactionType.RECHARGE) {
            throw new IllegalArgumentException("Commissions derive from recharges only, got " + recharge.getType());
        }

        return repository.findByTransactionId(recharge.getId())
            .map(existing -> {
                log.debug("Commission {} already exists for transaction {}", existing.getId(), recharge.getId());
                return existing.toDomain();
            })
            .orElseGet(() -> create(recharge, franchiseId, ratePercent));
    }

    @Transactional(readOnly = true)
    public Commission get(UUID commissionId) {
        return repository.findById(commissionId)
            .map(CommissionEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Commission", commissionId));
    }

    @Transactional(readOnly = true)
    public Optional<Commission> findForTransaction(UUID transactionId) {
        return repository.findByTransactionId(transactionId).map(CommissionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Commission> list(CommissionStatus status, UUID establishmentId) {
        List<CommissionEntity> rows;
        if (status != null && establishmentId != null) {
            rows = repository.findByStatusAndEstablishmentIdOrderByCreatedAtDesc(status, establishmentId);
        } else if (status != null) {
            rows = repository.findByStatusOrderByCreatedAtDesc(status);
        } else if (establishmentId != null) {
            rows = repository.findByEstablishmentIdOrderByCreatedAtDesc(establishmentId);
        } else {
            rows = repository.findAllByOrderByCreatedAtDesc();
        }
        return rows.stream().map(CommissionEntity::toDomain).toList();
    }

    private Commission create(GiftCardTransaction recharge, UUID franchiseId, BigDecimal ratePercent) {
        BigDecimal amount = CommissionCalculator.commissionFor(recharge.getAmount(), ratePercent);
        Commission commission = Commission.pending(
            UUID.randomUUID(),
            franchiseId,
            recharge.getEstablishmentId(),
            recharge.getId(),
            amount,
            ratePercent
        );

        Commission saved = repository.saveAndFlush(CommissionEntity.fromDomain(commission)).toDomain();
        jobQueue.enqueue(JobKind.COMMISSION_CHARGE, saved.getId(), CommissionChargeJob.forCommission(saved.getId()));

        log.info("Created commission {} of {} ({}%) for recharge {}",
            saved.getId(), amount, ratePercent, recharge.getId());
        return saved;
    }
}

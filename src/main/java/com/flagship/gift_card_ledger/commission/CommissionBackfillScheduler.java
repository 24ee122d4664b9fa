package com.flagship.gift_card_ledger.commission;

import com.flagship.gift_card_ledger.directory.EstablishmentDirectory;
import com.flagship.gift_card_ledger.giftcard.GiftCard;
import com.flagship.gift_card_ledger.giftcard.GiftCardTransaction;
import com.flagship.gift_card_ledger.giftcard.LedgerStore;
import com.flagship.gift_card_ledger.observability.GiftCardMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Creates commissions for recharges that committed without one.
 *
 * Recharge commits the balance change first and creates the commission
 * afterwards; a crash or database error in between leaves a recharge with no
 * commission. This sweep finds those and creates them with the rate captured
 * in the transaction metadata. The grace period keeps it from racing a
 * recharge that is still creating its own commission.
 */
@Component
@ConditionalOnProperty(name = "commission.backfill.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CommissionBackfillScheduler {

    private static final int BATCH_SIZE = 100;

    private final LedgerStore ledgerStore;
    private final EstablishmentDirectory directory;
    private final CommissionService commissionService;
    private final GiftCardMetrics metrics;

    @Value("${commission.backfill.grace-period-seconds:60}")
    private long gracePeriodSeconds;

    @Scheduled(fixedDelayString = "${commission.backfill.interval-ms:300000}",
               initialDelayString = "${commission.backfill.interval-ms:300000}")
    public void backfill() {
        Instant cutoff = Instant.now().minus(Duration.ofSeconds(gracePeriodSeconds));
        List<GiftCardTransaction> orphans = ledgerStore.findRechargesWithoutCommission(cutoff, BATCH_SIZE);
        if (orphans.isEmpty()) {
            return;
        }

        log.warn("Found {} recharge(s) without a commission, backfilling", orphans.size());
        int created = 0;
        for (GiftCardTransaction recharge : orphans) {
            try {
                backfillOne(recharge);
                created++;
            } catch (DataIntegrityViolationException e) {
                log.info("Commission for transaction {} was created concurrently", recharge.getId());
            } catch (Exception e) {
                metrics.recordCommissionCreationFailure();
                log.error("Backfill failed for transaction {}: {}", recharge.getId(), e.getMessage(), e);
            }
        }
        log.info("Commission backfill created {}/{} commission(s)", created, orphans.size());
    }

    private void backfillOne(GiftCardTransaction recharge) {
        GiftCard card = ledgerStore.findById(recharge.getGiftCardId())
            .orElseThrow(() -> new IllegalStateException("Gift card missing for transaction " + recharge.getId()));

        BigDecimal rate = recharge.commissionRateSnapshot();
        if (rate == null) {
            rate = directory.getEstablishment(recharge.getEstablishmentId()).getCommissionRate();
            log.warn("Transaction {} has no rate snapshot, using current franchise rate {}", recharge.getId(), rate);
        }
        commissionService.createPendingForRecharge(recharge, card.getFranchiseId(), rate);
    }
}

package com.flagship.gift_card_ledger.giftcard;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Moves ACTIVE cards past their validity to EXPIRED.
 *
 * Balance operations already refuse expired cards by date; this keeps the
 * stored status in line for listings and balance inquiries.
 */
@Component
@ConditionalOnProperty(name = "gift-card.expiry.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class GiftCardExpiryScheduler {

    private final LedgerStore ledgerStore;

    @Scheduled(cron = "${gift-card.expiry.cron:0 0 * * * *}")
    public void expireOverdueCards() {
        int expired = ledgerStore.expireOverdue(Instant.now());
        if (expired > 0) {
            log.info("Expired {} gift card(s) past their validity", expired);
        }
    }
}

package com.flagship.gift_card_ledger.webhook;

import com.flagship.gift_card_ledger.job.JobKind;
import com.flagship.gift_card_ledger.job.JobQueue;
import com.flagship.gift_card_ledger.job.PaymentWebhookJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Queues verified webhook notifications for asynchronous processing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookIntakeService {

    private final JobQueue jobQueue;

    @Transactional
    public void enqueue(PaymentWebhookJob job) {
        jobQueue.enqueue(JobKind.PAYMENT_WEBHOOK, job.partitionKey(), job);
        log.info("Queued gateway event {} for charge {} (reference {})",
            job.getEventCode(), job.getChargeRef(), job.getExternalReference());
    }
}

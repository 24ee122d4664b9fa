package com.flagship.gift_card_ledger.job;

import lombok.Value;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * A verified gateway notification waiting to be applied to its commission.
 * {@code eventCode} is kept raw; it is classified when the job runs.
 */
@Value
public class PaymentWebhookJob {
    UUID jobId;
    String eventCode;
    String chargeRef;
    String externalReference;
    BigDecimal value;
    Instant paymentConfirmedAt;
    Instant receivedAt;

    /**
     * Identity of the notification itself: the same event for the same charge
     * always maps to the same id, however many times the gateway delivers it.
     */
    public UUID deliveryId() {
        String subject = chargeRef != null ? chargeRef : externalReference;
        return UUID.nameUUIDFromBytes((subject + ":" + eventCode).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Partition key: all notifications for one charge land on the same partition.
     */
    public UUID partitionKey() {
        String subject = chargeRef != null ? chargeRef : externalReference;
        return subject != null
            ? UUID.nameUUIDFromBytes(subject.getBytes(StandardCharsets.UTF_8))
            : jobId;
    }
}

package com.flagship.gift_card_ledger.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.gift_card_ledger.job.PaymentWebhookJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads the gateway's webhook body into a {@link PaymentWebhookJob}.
 *
 * Expected shape:
 * <pre>
 * {"event": "PAYMENT_CONFIRMED",
 *  "payment": {"id": "pay_123", "externalReference": "...", "value": 12.50,
 *              "confirmedDate": "2024-05-01", "paymentDate": "2024-05-01"}}
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentWebhookParser {

    private final ObjectMapper objectMapper;

    /**
     * @return the job, or empty if the body is not a payment notification
     */
    public Optional<PaymentWebhookJob> parse(String rawBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (Exception e) {
            log.warn("Webhook body is not valid JSON: {}", e.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        String eventCode = text(root, "event");
        JsonNode payment = root.path("payment");
        String chargeRef = text(payment, "id");
        String externalReference = text(payment, "externalReference");
        if (eventCode == null || (chargeRef == null && externalReference == null)) {
            log.warn("Webhook body has no event code or payment reference");
            return Optional.empty();
        }

        BigDecimal value = payment.hasNonNull("value") ? payment.get("value").decimalValue() : null;
        Instant confirmedAt = date(text(payment, "confirmedDate"));
        if (confirmedAt == null) {
            confirmedAt = date(text(payment, "paymentDate"));
        }

        return Optional.of(new PaymentWebhookJob(
            UUID.randomUUID(),
            eventCode,
            chargeRef,
            externalReference,
            value,
            confirmedAt,
            Instant.now()
        ));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    // The gateway sends plain dates; full timestamps are accepted too.
    private static Instant date(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException ignored) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException e) {
                log.debug("Unparseable payment date {}", value);
                return null;
            }
        }
    }
}

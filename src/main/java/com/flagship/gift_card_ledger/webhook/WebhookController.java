package com.flagship.gift_card_ledger.webhook;

import com.flagship.gift_card_ledger.gateway.WebhookSignatureVerifier;
import com.flagship.gift_card_ledger.job.PaymentWebhookJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Gateway webhook endpoint.
 *
 * Verifies the signature over the raw body, queues the notification and
 * acknowledges. Once the signature is valid the response is always 200, even
 * for bodies that cannot be used, so the gateway does not keep redelivering them.
 */
@RestController
@RequestMapping("/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";

    private final WebhookSignatureVerifier signatureVerifier;
    private final PaymentWebhookParser parser;
    private final WebhookIntakeService intakeService;

    @PostMapping("/payments")
    public ResponseEntity<Map<String, Object>> receivePaymentEvent(
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestBody(required = false) String rawBody) {
        signatureVerifier.verify(rawBody, signature);

        Optional<PaymentWebhookJob> job = parser.parse(rawBody);
        if (job.isEmpty()) {
            log.warn("Acknowledging unusable webhook without queuing it");
            return ResponseEntity.ok(Map.of("received", true, "accepted", false));
        }

        intakeService.enqueue(job.get());
        return ResponseEntity.ok(Map.of("received", true, "accepted", true));
    }
}

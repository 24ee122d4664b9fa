package com.flagship.gift_card_ledger.webhook;

import com.flagship.gift_card_ledger.gateway.WebhookSignatureVerifier;
import com.flagship.gift_card_ledger.job.JobKind;
import com.flagship.gift_card_ledger.outbox.OutboxEvent;
import com.flagship.gift_card_ledger.outbox.OutboxService;
import com.flagship.gift_card_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Webhook intake.
 *
 * These tests verify:
 * - Unsigned and wrongly signed notifications are rejected with 401 and not queued
 * - A signed notification is acknowledged and queued as a job
 * - A signed but unusable body is acknowledged without being queued
 */
@AutoConfigureMockMvc
class WebhookControllerTest extends IntegrationTestSupport {

    private static final String URL = "/webhooks/payments";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private OutboxService outboxService;

    private static String body(String chargeRef) {
        return "{\"event\":\"PAYMENT_CONFIRMED\",\"payment\":{\"id\":\"" + chargeRef + "\","
            + "\"value\":5.00,\"confirmedDate\":\"2024-06-10\"}}";
    }

    private List<OutboxEvent> queuedFor(String chargeRef) {
        UUID key = UUID.nameUUIDFromBytes(chargeRef.getBytes(StandardCharsets.UTF_8));
        return outboxService.getEventsForAggregate(JobKind.PAYMENT_WEBHOOK.getAggregateType(), key);
    }

    @Test
    @DisplayName("Missing or invalid signature is rejected with 401 and nothing is queued")
    void testRejectsBadSignature() throws Exception {
        printTestHeader("Webhook Signature Rejected");

        String chargeRef = "pay_" + UUID.randomUUID();
        String payload = body(chargeRef);

        mockMvc.perform(post(URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.code").value("E_INVALID_SIGNATURE"));

        mockMvc.perform(post(URL)
                .header(WebhookController.SIGNATURE_HEADER, WebhookSignatureVerifier.sign("wrong-secret", payload))
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isUnauthorized());

        assertTrue(queuedFor(chargeRef).isEmpty());
        printSuccess("Nothing queued");
    }

    @Test
    @DisplayName("Signed notification is acknowledged and queued as a webhook job")
    void testQueuesSignedNotification() throws Exception {
        printTestHeader("Webhook Queued");

        String chargeRef = "pay_" + UUID.randomUUID();
        String payload = body(chargeRef);
        printInput("Charge", chargeRef);

        mockMvc.perform(post(URL)
                .header(WebhookController.SIGNATURE_HEADER,
                    "sha256=" + WebhookSignatureVerifier.sign(WEBHOOK_SECRET, payload))
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.received").value(true))
            .andExpect(jsonPath("$.accepted").value(true));

        List<OutboxEvent> queued = queuedFor(chargeRef);
        printOutput("Queued jobs", queued.size());
        assertEquals(1, queued.size());
        assertEquals(JobKind.PAYMENT_WEBHOOK.getEventType(), queued.get(0).getEventType());
        assertTrue(queued.get(0).getPayload().contains(chargeRef));
        assertFalse(queued.get(0).isPublished());
        printSuccess("Webhook queued");
    }

    @Test
    @DisplayName("Signed body without a payment reference is acknowledged but not queued")
    void testAcknowledgesUnusableBody() throws Exception {
        printTestHeader("Webhook Unusable Body");

        String payload = "{\"event\":\"PAYMENT_CONFIRMED\",\"payment\":{}}";

        mockMvc.perform(post(URL)
                .header(WebhookController.SIGNATURE_HEADER, WebhookSignatureVerifier.sign(WEBHOOK_SECRET, payload))
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.accepted").value(false));
        printSuccess("Acknowledged without queuing");
    }
}

package com.flagship.gift_card_ledger.gateway;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Payment gateway configuration ({@code gateway.*}).
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "gateway")
public class PaymentGatewayProperties {

    /** Active client: {@code fake} or {@code asaas}. */
    @NotBlank
    private String provider = "fake";

    @Valid
    private Webhook webhook = new Webhook();

    @Valid
    private Asaas asaas = new Asaas();

    @Getter @Setter
    @ToString
    public static class Webhook {
        /** Shared secret for the HMAC-SHA256 body signature. */
        @ToString.Exclude
        private String secret;
    }

    @Getter @Setter
    @ToString
    public static class Asaas {
        @NotBlank
        private String baseUrl = "https://sandbox.asaas.com/api/v3";

        @ToString.Exclude
        private String apiKey;

        @Valid
        private Timeouts timeouts = new Timeouts();
    }

    @Getter @Setter
    @ToString
    public static class Timeouts {
        private Duration connect = Duration.ofSeconds(2);
        private Duration read = Duration.ofSeconds(10);
    }
}

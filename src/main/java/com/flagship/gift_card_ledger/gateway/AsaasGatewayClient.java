package com.flagship.gift_card_ledger.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.gift_card_ledger.exception.GatewayException;
import io.netty.channel.ChannelOption;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Map;

/**
 * Asaas REST client.
 *
 * Calls are blocking: charge creation runs on job worker threads, never on a
 * request thread, so there is nothing to gain from propagating the reactive type.
 */
@Component
@ConditionalOnProperty(name = "gateway.provider", havingValue = "asaas")
@Slf4j
public class AsaasGatewayClient implements PaymentGatewayClient {

    private final WebClient client;
    private final Duration readTimeout;

    public AsaasGatewayClient(PaymentGatewayProperties properties) {
        PaymentGatewayProperties.Asaas asaas = properties.getAsaas();
        this.readTimeout = asaas.getTimeouts().getRead();

        HttpClient http = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) asaas.getTimeouts().getConnect().toMillis())
                .responseTimeout(readTimeout)
                .compress(true);

        this.client = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(http))
                .baseUrl(asaas.getBaseUrl())
                .defaultHeader("access_token", asaas.getApiKey())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public String createCustomer(CustomerProfile profile) {
        CustomerBody body = new CustomerBody(profile.getName(), profile.getDocument(), profile.getEmail(),
                profile.getPhone(), profile.getExternalReference());
        CreatedResource created = post("/customers", body, "create customer");
        log.info("Registered gateway customer {} for establishment {}", created.getId(), profile.getExternalReference());
        return created.getId();
    }

    @Override
    public ChargeResult createCharge(ChargeRequest request) {
        PaymentBody body = new PaymentBody(
                request.getCustomerRef(),
                request.getMethod().name(),
                request.getValue(),
                request.getDueDate(),
                request.getDescription(),
                request.getExternalReference(),
                request.getCreditCardToken());
        CreatedResource created = post("/payments", body, "create charge");
        log.info("Created gateway charge {} for reference {}", created.getId(), request.getExternalReference());
        return new ChargeResult(created.getId(), created.getStatus(), created.getInvoiceUrl(), created.getBankSlipUrl());
    }

    @Override
    public void cancelCharge(String chargeRef) {
        try {
            DeletedResource response = client.delete()
                    .uri("/payments/{id}", chargeRef)
                    .retrieve()
                    .bodyToMono(DeletedResource.class)
                    .block(readTimeout.plusSeconds(1));
            if (response == null || !response.isDeleted()) {
                throw new GatewayException("Gateway did not confirm deletion of charge " + chargeRef,
                        Map.of("chargeRef", chargeRef));
            }
            log.info("Deleted gateway charge {}", chargeRef);
        } catch (WebClientResponseException e) {
            throw new GatewayException(
                    String.format("Gateway rejected delete charge: HTTP %d", e.getStatusCode().value()),
                    Map.of("httpStatus", e.getStatusCode().value(), "chargeRef", chargeRef), e);
        } catch (WebClientException e) {
            throw new GatewayException("Gateway unreachable during delete charge: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            throw new GatewayException("Gateway timed out during delete charge", e);
        }
    }

    private CreatedResource post(String path, Object body, String operation) {
        try {
            CreatedResource response = client.post()
                    .uri(path)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(CreatedResource.class)
                    .block(readTimeout.plusSeconds(1));
            if (response == null || response.getId() == null) {
                throw new GatewayException("Gateway returned an empty response to " + operation);
            }
            return response;
        } catch (WebClientResponseException e) {
            throw new GatewayException(
                    String.format("Gateway rejected %s: HTTP %d", operation, e.getStatusCode().value()),
                    Map.of("httpStatus", e.getStatusCode().value(), "body", e.getResponseBodyAsString()),
                    e);
        } catch (WebClientException e) {
            throw new GatewayException("Gateway unreachable during " + operation + ": " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            // block() timed out
            throw new GatewayException("Gateway timed out during " + operation, e);
        }
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class CustomerBody {
        String name;
        String cpfCnpj;
        String email;
        String mobilePhone;
        String externalReference;
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class PaymentBody {
        String customer;
        String billingType;
        BigDecimal value;
        LocalDate dueDate;
        String description;
        String externalReference;
        String creditCardToken;
    }

    @Value
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DeletedResource {
        boolean deleted;
        String id;
    }

    @Value
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CreatedResource {
        String id;
        String status;
        String invoiceUrl;
        String bankSlipUrl;
    }
}

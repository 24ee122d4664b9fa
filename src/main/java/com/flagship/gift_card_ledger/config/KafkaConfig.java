package com.flagship.gift_card_ledger.config;

import com.flagship.gift_card_ledger.consumer.FailedJobRecoverer;
import com.flagship.gift_card_ledger.exception.InvalidOperationException;
import com.flagship.gift_card_ledger.exception.NotFoundException;
import com.flagship.gift_card_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.ExponentialBackOffWithMaxRetries;
import org.springframework.kafka.support.serializer.DeserializationException;

/**
 * Job topics and the retry policy for job consumers.
 *
 * A failing job is retried {@code jobs.attempts - 1} times with exponential
 * backoff (5 s, 10 s, ... by default), then handed to
 * {@link FailedJobRecoverer}. Errors that a retry cannot fix go to the
 * recoverer immediately.
 */
@Configuration
@Slf4j
public class KafkaConfig {

    @Value("${kafka.topic.commission-charge-jobs:gift-card.commission-charge-jobs}")
    private String commissionChargeTopic;

    @Value("${kafka.topic.payment-webhook-jobs:gift-card.payment-webhook-jobs}")
    private String paymentWebhookTopic;

    @Value("${jobs.attempts:3}")
    private int attempts;

    @Value("${jobs.backoff.initial-delay-ms:5000}")
    private long initialDelayMs;

    @Value("${jobs.backoff.multiplier:2.0}")
    private double multiplier;

    @Bean
    public NewTopic commissionChargeJobsTopic() {
        return TopicBuilder.name(commissionChargeTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic paymentWebhookJobsTopic() {
        return TopicBuilder.name(paymentWebhookTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    /**
     * Picked up by the auto-configured listener container factory.
     */
    @Bean
    public DefaultErrorHandler jobErrorHandler(FailedJobRecoverer recoverer) {
        ExponentialBackOffWithMaxRetries backOff = new ExponentialBackOffWithMaxRetries(Math.max(0, attempts - 1));
        backOff.setInitialInterval(initialDelayMs);
        backOff.setMultiplier(multiplier);

        DefaultErrorHandler handler = new DefaultErrorHandler(recoverer, backOff);
        handler.addNotRetryableExceptions(
                ValidationException.class,
                NotFoundException.class,
                InvalidOperationException.class,
                DeserializationException.class);
        handler.setRetryListeners((record, ex, deliveryAttempt) ->
                log.warn("Job attempt {} failed: topic={}, key={}, error={}",
                        deliveryAttempt, record.topic(), record.key(), ex.getMessage()));
        return handler;
    }
}

package com.flagship.gift_card_ledger.giftcard;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps client idempotency keys to the balance transaction they produced.
 *
 * Redis is a fast path only. The unique {@code idempotency_key} column on
 * {@code gift_card_transactions} is the source of truth, so a Redis outage
 * degrades latency and never correctness.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:gift-card-tx:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LedgerStore ledgerStore;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(LedgerStore ledgerStore,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.ledgerStore = ledgerStore;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Looks up the transaction already recorded for a key.
     *
     * @return the transaction id, or empty if the key is unused
     */
    public Optional<UUID> findTransactionId(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = ledgerStore.findTransactionByIdempotencyKey(idempotencyKey)
                .map(GiftCardTransaction::getId);
        stored.ifPresent(transactionId -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, transactionId);
        });
        return stored;
    }

    /**
     * Records a key in Redis after its transaction has committed. Best effort.
     */
    public void remember(String idempotencyKey, UUID transactionId) {
        if (idempotencyKey == null || transactionId == null) {
            return;
        }
        cache(idempotencyKey, transactionId);
    }

    private void cache(String idempotencyKey, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey,
                    transactionId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }
}

package com.flagship.gift_card_ledger.config;

import com.flagship.gift_card_ledger.giftcard.GiftCardQrCodeRenderer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.CachingConfigurer;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.RedisSerializer;

import java.time.Duration;
import java.util.Map;

/**
 * Redis-backed caches with a bounded lifetime per entry.
 *
 * Cache failures are logged and the cached method runs as if nothing was
 * cached, so a Redis outage slows card issuance down but never fails it.
 */
@Configuration
@Slf4j
public class CacheConfig implements CachingConfigurer {

    private final Duration qrCodeTtl;

    public CacheConfig(@Value("${gift-card.qr-code.cache-ttl-hours:24}") long qrCodeTtlHours) {
        this.qrCodeTtl = Duration.ofHours(qrCodeTtlHours);
    }

    @Bean
    public CacheManager cacheManager(RedisConnectionFactory connectionFactory) {
        return RedisCacheManager.builder(connectionFactory)
            .cacheDefaults(qrCodeCacheConfiguration())
            .withInitialCacheConfigurations(Map.of(GiftCardQrCodeRenderer.CACHE_NAME, qrCodeCacheConfiguration()))
            .disableCreateOnMissingCache()
            .build();
    }

    RedisCacheConfiguration qrCodeCacheConfiguration() {
        return RedisCacheConfiguration.defaultCacheConfig()
            .entryTtl(qrCodeTtl)
            .prefixCacheNameWith("gift-card-ledger:")
            .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(RedisSerializer.string()))
            .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(RedisSerializer.string()))
            .disableCachingNullValues();
    }

    @Bean
    @Override
    public CacheErrorHandler errorHandler() {
        return new CacheErrorHandler() {
            @Override
            public void handleCacheGetError(RuntimeException exception, Cache cache, Object key) {
                log.warn("Cache get failed for {} in {}: {}", key, cache.getName(), exception.getMessage());
            }

            @Override
            public void handleCachePutError(RuntimeException exception, Cache cache, Object key, Object value) {
                log.warn("Cache put failed for {} in {}: {}", key, cache.getName(), exception.getMessage());
            }

            @Override
            public void handleCacheEvictError(RuntimeException exception, Cache cache, Object key) {
                log.warn("Cache evict failed for {} in {}: {}", key, cache.getName(), exception.getMessage());
            }

            @Override
            public void handleCacheClearError(RuntimeException exception, Cache cache) {
                log.warn("Cache clear failed in {}: {}", cache.getName(), exception.getMessage());
            }
        };
    }
}

package com.securehealth.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.securehealth.infrastructure.keyvault.DataKey;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

/**
 * Caffeine caches for data keys.
 *
 * Security:
 * - Only wrapped key material is cached, never plaintext keys
 * - Bounded TTL so a key vault change is picked up without restart
 */
@Configuration
@Slf4j
public class CacheConfiguration {

    @Bean
    public Cache<String, DataKey> dataKeysByAltName(PhiEncryptionProperties properties, MeterRegistry meterRegistry) {
        return CaffeineCacheMetrics.monitor(meterRegistry, newKeyCache(properties), "dataKeysByAltName");
    }

    @Bean
    public Cache<UUID, DataKey> dataKeysById(PhiEncryptionProperties properties, MeterRegistry meterRegistry) {
        return CaffeineCacheMetrics.monitor(meterRegistry, newKeyCache(properties), "dataKeysById");
    }

    private static <K> Cache<K, DataKey> newKeyCache(PhiEncryptionProperties properties) {
        log.info("Configuring data key cache (ttl={}, maxSize={})",
            properties.getKeyCacheTtl(), properties.getKeyCacheMaxSize());
        return Caffeine.newBuilder()
            .maximumSize(properties.getKeyCacheMaxSize())
            .expireAfterWrite(properties.getKeyCacheTtl())
            .recordStats()
            .build();
    }
}

package com.hookrelay.common.config;

import com.hookrelay.common.store.AtomicStore;
import com.hookrelay.common.store.AtomicStoreHealthIndicator;
import com.hookrelay.common.store.LocalAtomicStore;
import com.hookrelay.common.store.RedisAtomicStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Selects the shared store implementation from {@code hookrelay.store.type}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(HookRelayProperties.class)
public class AtomicStoreConfiguration {

    @Bean
    @ConditionalOnProperty(name = "hookrelay.store.type", havingValue = "redis", matchIfMissing = true)
    public AtomicStore redisAtomicStore(StringRedisTemplate stringRedisTemplate) {
        log.info("Using Redis atomic store");
        return new RedisAtomicStore(stringRedisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "hookrelay.store.type", havingValue = "local")
    public AtomicStore localAtomicStore(Clock clock) {
        log.warn("Using local in-process atomic store: locks, rate limits and dedup are NOT shared across replicas");
        return new LocalAtomicStore(clock);
    }

    @Bean
    public AtomicStoreHealthIndicator atomicStoreHealthIndicator(AtomicStore atomicStore) {
        return new AtomicStoreHealthIndicator(atomicStore);
    }
}

package com.llmrouter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmrouter.cache.KeyCache;
import com.llmrouter.cache.NoOpKeyCache;
import com.llmrouter.cache.RedisKeyCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

/**
 * Key cache selection.
 * <p>
 * {@code gateway.cache.type}:
 * <ul>
 *   <li>{@code none} (default): every verification goes to the database</li>
 *   <li>{@code redis}: Redis cache shared across instances</li>
 * </ul>
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(name = "gateway.cache.type", havingValue = "none", matchIfMissing = true)
    public KeyCache noOpKeyCache() {
        log.info("Key cache disabled, verifications go straight to the key store");
        return new NoOpKeyCache();
    }

    @Bean
    @ConditionalOnProperty(name = "gateway.cache.type", havingValue = "redis")
    public KeyCache redisKeyCache(ReactiveStringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                  GatewayProperties properties) {
        log.info("Using Redis key cache (ttl={})", properties.getCache().getTtl());
        return new RedisKeyCache(redisTemplate, objectMapper, properties.getCache());
    }
}

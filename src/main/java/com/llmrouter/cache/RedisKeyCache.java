package com.llmrouter.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmrouter.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import reactor.core.publisher.Mono;

/**
 * Redis-backed key cache, shared by every gateway instance.
 *
 * Values are JSON snapshots stored under {@code api_key:<secretHash>} with a TTL.
 */
@Slf4j
public class RedisKeyCache implements KeyCache {

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final GatewayProperties.Cache properties;

    public RedisKeyCache(ReactiveStringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                         GatewayProperties.Cache properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public Mono<CachedKey> get(String secretHash) {
        return redisTemplate.opsForValue()
                .get(cacheKey(secretHash))
                .flatMap(json -> Mono.fromCallable(() -> objectMapper.readValue(json, CachedKey.class)));
    }

    @Override
    public Mono<Void> put(String secretHash, CachedKey entry) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(entry))
                .flatMap(json -> redisTemplate.opsForValue().set(cacheKey(secretHash), json, properties.getTtl()))
                .doOnNext(stored -> log.debug("Cached key {} (active={})", entry.getId(), entry.isActive()))
                .then();
    }

    private String cacheKey(String secretHash) {
        return properties.getKeyPrefix() + secretHash;
    }
}

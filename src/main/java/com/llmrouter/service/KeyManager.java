package com.llmrouter.service;

import com.llmrouter.cache.CachedKey;
import com.llmrouter.cache.KeyCache;
import com.llmrouter.config.GatewayProperties;
import com.llmrouter.exception.ForbiddenOperationException;
import com.llmrouter.exception.InvalidApiKeyException;
import com.llmrouter.model.entity.ApiKey;
import com.llmrouter.repository.ApiKeyRepository;
import com.llmrouter.util.ApiKeyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Issues, verifies, touches and revokes API keys.
 *
 * <p>Verification consults the {@link KeyCache} first. A cached inactive entry
 * rejects immediately; a cached active entry is confirmed against the store by id.
 * Cache failures are logged and treated as misses.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KeyManager {

    private static final String KEY_ID_PREFIX = "ak_";

    private final ApiKeyRepository apiKeyRepository;
    private final KeyCache keyCache;
    private final GatewayProperties properties;
    private final Clock clock;

    /**
     * Create a new API key.
     *
     * @param name Friendly name
     * @param description Optional description
     * @return the stored key together with its raw secret, shown to the caller once
     */
    @Transactional
    public Mono<CreatedKey> create(String name, String description) {
        return Mono.defer(() -> {
            String secret = ApiKeyUtil.generateApiKey(properties.getApiKeyPrefix());
            String secretHash = ApiKeyUtil.hashApiKey(secret);

            ApiKey key = ApiKey.builder()
                    .id(ApiKeyUtil.generateId(KEY_ID_PREFIX))
                    .secretHash(secretHash)
                    .name(name)
                    .description(description != null ? description : "")
                    .active(true)
                    .rateLimit(properties.getDefaultRateLimit())
                    .usageCount(0)
                    .createdAt(LocalDateTime.now(clock))
                    .fresh(true)
                    .build();

            return apiKeyRepository.save(key)
                    .flatMap(saved -> cacheQuietly(secretHash, saved).thenReturn(new CreatedKey(secret, saved)))
                    .doOnNext(created -> log.info("Created API key {} ({})",
                            created.getApiKey().getId(), created.getApiKey().getName()));
        });
    }

    /**
     * Verify a raw secret.
     *
     * @param rawSecret Secret as presented by the caller
     * @return the active key, or {@link InvalidApiKeyException} whether the key is unknown or inactive
     */
    public Mono<ApiKey> verify(String rawSecret) {
        if (rawSecret == null || !rawSecret.startsWith(properties.getApiKeyPrefix())) {
            return Mono.error(new InvalidApiKeyException());
        }
        String secretHash = ApiKeyUtil.hashApiKey(rawSecret);

        return readCache(secretHash)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(cached -> cached
                        .map(this::confirmCached)
                        .orElseGet(() -> lookupStore(secretHash)))
                .switchIfEmpty(Mono.error(InvalidApiKeyException::new));
    }

    /**
     * Record one use of the key. The increment is a single UPDATE at the store,
     * so concurrent touches of the same key are never lost.
     *
     * @return the key as stored after the increment
     */
    public Mono<ApiKey> touch(ApiKey key) {
        return apiKeyRepository.incrementUsage(key.getId(), LocalDateTime.now(clock))
                .flatMap(updated -> updated > 0
                        ? apiKeyRepository.findById(key.getId())
                        : Mono.error(new InvalidApiKeyException()));
    }

    /**
     * Deactivate a key. Callers may only revoke the key they authenticated with.
     */
    @Transactional
    public Mono<Void> revoke(ApiKey caller, String keyId) {
        if (!caller.getId().equals(keyId)) {
            return Mono.error(new ForbiddenOperationException("You can only delete your own API key"));
        }
        return apiKeyRepository.deactivate(keyId)
                .flatMap(rows -> cacheQuietly(caller.getSecretHash(), CachedKey.builder()
                        .id(caller.getId())
                        .name(caller.getName())
                        .active(false)
                        .build()))
                .doOnSuccess(ignored -> log.info("Deactivated API key {}", keyId));
    }

    private Mono<ApiKey> confirmCached(CachedKey cached) {
        if (!cached.isActive()) {
            log.warn("Rejected inactive API key {} from cache", cached.getId());
            return Mono.error(new InvalidApiKeyException());
        }
        return apiKeyRepository.findByIdAndActiveTrue(cached.getId());
    }

    private Mono<ApiKey> lookupStore(String secretHash) {
        return apiKeyRepository.findBySecretHashAndActiveTrue(secretHash)
                .flatMap(key -> cacheQuietly(secretHash, key).thenReturn(key));
    }

    private Mono<CachedKey> readCache(String secretHash) {
        return keyCache.get(secretHash)
                .onErrorResume(e -> {
                    log.warn("Key cache read failed, falling back to store: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    // Cache writes are advisory: a failure leaves the store authoritative
    private Mono<Void> cacheQuietly(String secretHash, ApiKey key) {
        return cacheQuietly(secretHash, CachedKey.builder()
                .id(key.getId())
                .name(key.getName())
                .active(key.isActive())
                .build());
    }

    private Mono<Void> cacheQuietly(String secretHash, CachedKey entry) {
        return keyCache.put(secretHash, entry)
                .onErrorResume(e -> {
                    log.warn("Key cache write failed for {}: {}", entry.getId(), e.getMessage());
                    return Mono.empty();
                });
    }
}

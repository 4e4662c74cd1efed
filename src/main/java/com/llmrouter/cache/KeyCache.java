package com.llmrouter.cache;

import reactor.core.publisher.Mono;

/**
 * Fast-path existence/validity cache in front of the key store.
 *
 * <p>Entries are advisory: callers must tolerate errors from every method and
 * fall back to the store. Entries are keyed by the secret hash, never by the raw secret.
 */
public interface KeyCache {

    /**
     * @return the cached entry, or empty on a miss
     */
    Mono<CachedKey> get(String secretHash);

    /**
     * Store an entry with the configured TTL.
     */
    Mono<Void> put(String secretHash, CachedKey entry);
}

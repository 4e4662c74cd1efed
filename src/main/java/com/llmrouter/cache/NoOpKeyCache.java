package com.llmrouter.cache;

import reactor.core.publisher.Mono;

/**
 * Cache used when no cache backend is configured. Every lookup misses.
 */
public class NoOpKeyCache implements KeyCache {

    @Override
    public Mono<CachedKey> get(String secretHash) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> put(String secretHash, CachedKey entry) {
        return Mono.empty();
    }
}

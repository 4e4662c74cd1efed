package com.llmrouter.repository;

import com.llmrouter.model.entity.ApiKey;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Repository for API Key entities.
 *
 * Lookups used for authentication always carry the active predicate.
 */
@Repository
public interface ApiKeyRepository extends ReactiveCrudRepository<ApiKey, String> {

    /**
     * Find an active API key by secret hash.
     */
    Mono<ApiKey> findBySecretHashAndActiveTrue(String secretHash);

    /**
     * Find an active API key by id.
     */
    Mono<ApiKey> findByIdAndActiveTrue(String id);

    /**
     * Increment the usage counter and stamp the last-used time in one statement.
     *
     * @return number of rows updated (0 when the key is gone or inactive)
     */
    @Modifying
    @Query("UPDATE api_keys SET usage_count = usage_count + 1, last_used_at = :usedAt "
            + "WHERE id = :id AND is_active = TRUE")
    Mono<Integer> incrementUsage(String id, LocalDateTime usedAt);

    /**
     * Soft delete.
     */
    @Modifying
    @Query("UPDATE api_keys SET is_active = FALSE WHERE id = :id")
    Mono<Integer> deactivate(String id);
}

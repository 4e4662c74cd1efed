package com.llmrouter.repository;

import com.llmrouter.model.entity.UsageRecord;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

/**
 * Repository for usage records.
 */
@Repository
public interface UsageRecordRepository extends ReactiveCrudRepository<UsageRecord, String> {

    Flux<UsageRecord> findByApiKeyId(String apiKeyId);
}

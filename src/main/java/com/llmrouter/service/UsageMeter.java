package com.llmrouter.service;

import com.llmrouter.model.dto.ProviderUsage;
import com.llmrouter.model.dto.UsageResponse;
import com.llmrouter.model.entity.UsageRecord;
import com.llmrouter.model.upstream.Usage;
import com.llmrouter.repository.UsageRecordRepository;
import com.llmrouter.util.ApiKeyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records token usage and cost per request, and aggregates it per key.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UsageMeter {

    private static final String RECORD_ID_PREFIX = "log_";

    private final UsageRecordRepository usageRecordRepository;
    private final PricingTable pricingTable;
    private final Clock clock;

    /**
     * Append a usage record. Best effort: a failed write is logged and the
     * returned Mono still completes normally.
     */
    public Mono<Void> record(String apiKeyId, String provider, String model, String endpoint, Usage usage) {
        return Mono.fromCallable(() -> UsageRecord.builder()
                        .id(ApiKeyUtil.generateId(RECORD_ID_PREFIX))
                        .apiKeyId(apiKeyId)
                        .provider(provider)
                        .model(model)
                        .endpoint(endpoint)
                        .promptTokens(usage.getPromptTokens())
                        .completionTokens(usage.getCompletionTokens())
                        .totalTokens(usage.getTotalTokens())
                        .cost(pricingTable.cost(provider, model, usage.getTotalTokens()))
                        .timestamp(LocalDateTime.now(clock))
                        .fresh(true)
                        .build())
                .flatMap(usageRecordRepository::save)
                .doOnNext(saved -> log.info("Recorded {} tokens ({} {}) for key {}, cost {}",
                        saved.getTotalTokens(), provider, model, apiKeyId, saved.getCost()))
                .then()
                .onErrorResume(e -> {
                    log.warn("Failed to record usage for key {} on {}: {}", apiKeyId, provider, e.getMessage());
                    return Mono.empty();
                });
    }

    /**
     * Totals for a key, with requests, tokens and cost broken down by provider.
     */
    public Mono<UsageResponse> summarize(String apiKeyId) {
        return usageRecordRepository.findByApiKeyId(apiKeyId)
                .collectList()
                .map(records -> aggregate(apiKeyId, records));
    }

    private UsageResponse aggregate(String apiKeyId, List<UsageRecord> records) {
        Map<String, ProviderUsage> breakdown = new LinkedHashMap<>();
        long totalTokens = 0;
        double totalCost = 0;
        for (UsageRecord record : records) {
            totalTokens += record.getTotalTokens();
            totalCost += record.getCost();
            ProviderUsage providerUsage = breakdown.computeIfAbsent(record.getProvider(),
                    name -> new ProviderUsage(0, 0, 0));
            providerUsage.setRequests(providerUsage.getRequests() + 1);
            providerUsage.setTokens(providerUsage.getTokens() + record.getTotalTokens());
            providerUsage.setCost(providerUsage.getCost() + record.getCost());
        }
        return UsageResponse.builder()
                .apiKeyId(apiKeyId)
                .totalRequests(records.size())
                .totalTokens(totalTokens)
                .totalCost(totalCost)
                .providerBreakdown(breakdown)
                .build();
    }
}

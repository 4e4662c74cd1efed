package com.llmrouter.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Usage totals for one API key, with a per-provider breakdown.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageResponse {
    private String apiKeyId;
    private long totalRequests;
    private long totalTokens;
    private double totalCost;
    private Map<String, ProviderUsage> providerBreakdown;
}

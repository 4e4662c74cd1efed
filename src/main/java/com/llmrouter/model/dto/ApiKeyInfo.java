package com.llmrouter.model.dto;

import com.llmrouter.model.entity.ApiKey;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Public view of an API key. Never carries the secret or its hash.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyInfo {
    private String id;
    private String name;
    private String description;
    private boolean active;
    private int rateLimit;
    private long usageCount;
    private LocalDateTime createdAt;
    private LocalDateTime lastUsedAt;

    public static ApiKeyInfo from(ApiKey key) {
        return ApiKeyInfo.builder()
                .id(key.getId())
                .name(key.getName())
                .description(key.getDescription())
                .active(key.isActive())
                .rateLimit(key.getRateLimit())
                .usageCount(key.getUsageCount())
                .createdAt(key.getCreatedAt())
                .lastUsedAt(key.getLastUsedAt())
                .build();
    }
}

package com.llmrouter.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Response DTO for API key creation.
 * Contains the raw key which is only returned once at creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyCreateResponse {
    private String id;
    private String name;
    private String key;
    private String description;
    private LocalDateTime createdAt;
    private int rateLimit;
    private long usageCount;
}

package com.llmrouter.service;

import com.llmrouter.model.entity.ApiKey;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of key creation. The raw secret exists only here and is never stored.
 */
@Getter
@AllArgsConstructor
public class CreatedKey {
    private final String rawSecret;
    private final ApiKey apiKey;
}

package com.llmrouter.service;

import com.llmrouter.model.entity.ApiKey;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * Claims of a verified bearer token, together with the live key it refers to.
 */
@Getter
@Builder
public class TokenClaims {
    private final String apiKeyId;
    private final String apiKeyName;
    private final String tokenId;
    private final Instant issuedAt;
    private final Instant expiresAt;
    private final ApiKey apiKey;
}

package com.llmrouter.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenVerifyResponse {
    private boolean valid;
    private String apiKeyId;
    private String apiKeyName;
    private String tokenId;
    private Instant expiresAt;
    private String message;
}

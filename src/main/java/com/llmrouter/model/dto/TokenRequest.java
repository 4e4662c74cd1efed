package com.llmrouter.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to exchange an API key for a bearer token.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenRequest {

    @NotBlank(message = "API key is required")
    private String apiKey;

    @Builder.Default
    @Min(value = 1, message = "Token expiry must be at least 1 hour")
    @Max(value = 168, message = "Token expiry cannot exceed 168 hours")
    private Integer expiresInHours = 24;
}

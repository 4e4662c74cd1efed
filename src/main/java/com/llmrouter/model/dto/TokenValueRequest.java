package com.llmrouter.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request carrying an existing bearer token (refresh, verify, revoke).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenValueRequest {

    @NotBlank(message = "Token is required")
    private String token;
}

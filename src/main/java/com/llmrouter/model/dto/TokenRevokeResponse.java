package com.llmrouter.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer to a revoke call. Tokens are not invalidated; {@code note} says so.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenRevokeResponse {
    private String message;
    private String note;
}

package com.llmrouter.security;

import com.llmrouter.config.GatewayProperties;
import com.llmrouter.exception.InvalidCredentialsException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Lifts a credential out of the request headers.
 *
 * <p>Accepted forms, in order:
 * <ul>
 *   <li>{@code x-api-key: <secret>}</li>
 *   <li>{@code Authorization: Bearer <secret>} or {@code Authorization: Bearer <jwt>}</li>
 *   <li>{@code Authorization: <secret>}</li>
 *   <li>any {@code Authorization} value with the key prefix somewhere inside it</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class CredentialExtractor {

    static final String API_KEY_HEADER = "x-api-key";
    private static final String BEARER_PREFIX = "Bearer ";

    private final GatewayProperties properties;

    public Credential extract(HttpHeaders headers) {
        String apiKeyHeader = headers.getFirst(API_KEY_HEADER);
        if (apiKeyHeader != null && !apiKeyHeader.isBlank()) {
            return fromRawValue(apiKeyHeader.trim());
        }

        String authHeader = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || authHeader.isBlank()) {
            throw new InvalidCredentialsException(
                    "Missing authorization header. Provide 'Authorization: Bearer <key>' or 'x-api-key: <key>'");
        }
        authHeader = authHeader.trim();

        if (authHeader.startsWith(BEARER_PREFIX)) {
            String value = authHeader.substring(BEARER_PREFIX.length()).trim();
            if (value.isEmpty()) {
                throw new InvalidCredentialsException("Empty bearer credential");
            }
            if (value.startsWith(prefix())) {
                return Credential.apiKey(value);
            }
            if (value.contains(prefix())) {
                return Credential.apiKey(embeddedKey(value));
            }
            return Credential.bearerToken(value);
        }
        return fromRawValue(authHeader);
    }

    private Credential fromRawValue(String value) {
        if (value.startsWith(prefix())) {
            return Credential.apiKey(value);
        }
        if (value.contains(prefix())) {
            return Credential.apiKey(embeddedKey(value));
        }
        throw new InvalidCredentialsException(
                "Invalid authorization format: API key must start with '" + prefix() + "'");
    }

    private String embeddedKey(String value) {
        return value.substring(value.indexOf(prefix())).split("\\s+")[0];
    }

    private String prefix() {
        return properties.getApiKeyPrefix();
    }
}

package com.llmrouter.controller;

import com.llmrouter.model.dto.TokenRequest;
import com.llmrouter.model.dto.TokenResponse;
import com.llmrouter.model.dto.TokenRevokeResponse;
import com.llmrouter.model.dto.TokenValueRequest;
import com.llmrouter.model.dto.TokenVerifyResponse;
import com.llmrouter.service.KeyManager;
import com.llmrouter.service.TokenManager;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Controller for exchanging API keys for bearer tokens.
 * All endpoints are public; the credential travels in the body.
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class TokenController {

    private static final int MIN_HOURS = 1;
    private static final int MAX_HOURS = 168;

    private final KeyManager keyManager;
    private final TokenManager tokenManager;

    @PostMapping("/token")
    public Mono<TokenResponse> createToken(@Valid @RequestBody TokenRequest request) {
        return issue(request.getApiKey(), request.getExpiresInHours());
    }

    @PostMapping(value = "/token/form", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public Mono<TokenResponse> createTokenForm(ServerWebExchange exchange) {
        return exchange.getFormData().flatMap(form -> {
            String apiKey = form.getFirst("api_key");
            if (apiKey == null || apiKey.isBlank()) {
                return Mono.error(new ServerWebInputException("api_key is required"));
            }
            String hours = form.getFirst("expires_in_hours");
            Integer expiresInHours;
            try {
                expiresInHours = hours == null || hours.isBlank() ? null : Integer.valueOf(hours.trim());
            } catch (NumberFormatException e) {
                return Mono.error(new ServerWebInputException("expires_in_hours must be a number"));
            }
            if (expiresInHours != null && (expiresInHours < MIN_HOURS || expiresInHours > MAX_HOURS)) {
                return Mono.error(new ServerWebInputException(
                        "expires_in_hours must be between " + MIN_HOURS + " and " + MAX_HOURS));
            }
            return issue(apiKey, expiresInHours);
        });
    }

    @PostMapping("/refresh")
    public Mono<TokenResponse> refreshToken(@Valid @RequestBody TokenValueRequest request) {
        return tokenManager.refresh(request.getToken());
    }

    @PostMapping("/verify")
    public Mono<TokenVerifyResponse> verifyToken(@Valid @RequestBody TokenValueRequest request) {
        return tokenManager.verify(request.getToken())
                .map(claims -> TokenVerifyResponse.builder()
                        .valid(true)
                        .apiKeyId(claims.getApiKeyId())
                        .apiKeyName(claims.getApiKeyName())
                        .tokenId(claims.getTokenId())
                        .expiresAt(claims.getExpiresAt())
                        .message("Token is valid")
                        .build());
    }

    @DeleteMapping("/revoke")
    public Mono<TokenRevokeResponse> revokeToken(@Valid @RequestBody TokenValueRequest request) {
        return tokenManager.revoke(request.getToken())
                .map(claims -> TokenRevokeResponse.builder()
                        .message("Token revoked successfully")
                        .note("JWT tokens cannot be truly revoked until expiry - use short expiry times for security")
                        .build());
    }

    // Issuing a token counts as a use of the key
    private Mono<TokenResponse> issue(String apiKey, Integer expiresInHours) {
        Duration ttl = expiresInHours != null ? Duration.ofHours(expiresInHours) : null;
        return keyManager.verify(apiKey)
                .flatMap(keyManager::touch)
                .flatMap(key -> tokenManager.issue(key.getId(), ttl));
    }
}

package com.llmrouter.controller;

import com.llmrouter.model.dto.ApiKeyCreateRequest;
import com.llmrouter.model.dto.ApiKeyCreateResponse;
import com.llmrouter.model.dto.ApiKeyInfo;
import com.llmrouter.security.CallerIdentity;
import com.llmrouter.service.KeyManager;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Controller for API key creation and self-management.
 */
@RestController
@RequestMapping("/v1/api-keys")
@RequiredArgsConstructor
public class ApiKeyController {

    private final KeyManager keyManager;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ApiKeyCreateResponse> createApiKey(@Valid @RequestBody ApiKeyCreateRequest request) {
        return keyManager.create(request.getName(), request.getDescription())
                .map(created -> ApiKeyCreateResponse.builder()
                        .id(created.getApiKey().getId())
                        .name(created.getApiKey().getName())
                        .key(created.getRawSecret())
                        .description(created.getApiKey().getDescription())
                        .createdAt(created.getApiKey().getCreatedAt())
                        .rateLimit(created.getApiKey().getRateLimit())
                        .usageCount(created.getApiKey().getUsageCount())
                        .build());
    }

    /**
     * Keys only see themselves, so the list holds a single element.
     */
    @GetMapping
    public Flux<ApiKeyInfo> listApiKeys(@AuthenticationPrincipal CallerIdentity caller) {
        return Flux.just(ApiKeyInfo.from(caller.getApiKey()));
    }

    @GetMapping("/current")
    public Mono<ApiKeyInfo> currentApiKey(@AuthenticationPrincipal CallerIdentity caller) {
        return Mono.just(ApiKeyInfo.from(caller.getApiKey()));
    }

    @DeleteMapping("/{keyId}")
    public Mono<Map<String, String>> deleteApiKey(
            @AuthenticationPrincipal CallerIdentity caller,
            @PathVariable String keyId) {
        return keyManager.revoke(caller.getApiKey(), keyId)
                .thenReturn(Map.of("message", "API key " + keyId + " deactivated successfully"));
    }
}

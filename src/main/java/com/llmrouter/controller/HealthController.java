package com.llmrouter.controller;

import com.llmrouter.provider.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service info and health check endpoints.
 */
@RestController
@RequestMapping
@RequiredArgsConstructor
public class HealthController {

    private static final String VERSION = "1.0.0";

    private final ProviderRegistry providerRegistry;

    @GetMapping("/")
    public Mono<Map<String, Object>> root() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("service", "LLM Router");
        info.put("version", VERSION);
        info.put("description", "Unified API gateway for multiple LLM providers");
        info.put("status", "online");
        info.put("endpoints", Map.of(
            "health", "/health",
            "models", "/v1/models",
            "chat", "/v1/chat/completions",
            "apiKeys", "/v1/api-keys",
            "usage", "/v1/usage",
            "tokens", "/auth/token"
        ));
        return Mono.just(info);
    }

    @GetMapping("/health")
    public Mono<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "healthy");
        health.put("providers", providerRegistry.listProviders().size());
        health.put("models", providerRegistry.knownModels().size());
        health.put("version", VERSION);
        return Mono.just(health);
    }
}

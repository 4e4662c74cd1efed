package com.llmrouter.config;

import com.llmrouter.provider.ProviderHandle;
import com.llmrouter.provider.ProviderRegistry;
import com.llmrouter.service.PricingTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Gateway wiring: providers, pricing and the clock shared by key, token and usage handling.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Providers are registered in configuration order. Disabled providers and
     * providers without an API key are not routed to, only reported.
     */
    @Bean
    public ProviderRegistry providerRegistry(GatewayProperties properties) {
        List<ProviderHandle> handles = new ArrayList<>();
        List<ProviderHandle> unavailable = new ArrayList<>();
        for (Map.Entry<String, GatewayProperties.Provider> entry : properties.getProviders().entrySet()) {
            GatewayProperties.Provider provider = entry.getValue();
            ProviderHandle handle = ProviderHandle.builder()
                    .name(entry.getKey())
                    .baseUrl(provider.getBaseUrl())
                    .apiKey(provider.getApiKey())
                    .models(List.copyOf(provider.getModels()))
                    .timeout(provider.getTimeout())
                    .streamUsage(provider.isStreamUsage())
                    .build();
            if (!provider.isEnabled()) {
                log.info("Provider {} is disabled", entry.getKey());
                unavailable.add(handle);
            } else if (provider.getApiKey() == null || provider.getApiKey().isBlank()) {
                log.warn("Provider {} has no API key configured, skipping", entry.getKey());
                unavailable.add(handle);
            } else {
                handles.add(handle);
            }
        }
        if (handles.isEmpty()) {
            log.warn("No providers registered; every completion request will be rejected");
        }
        return new ProviderRegistry(handles, unavailable);
    }

    @Bean
    public PricingTable pricingTable(GatewayProperties properties) {
        return new PricingTable(properties.getPricing());
    }
}

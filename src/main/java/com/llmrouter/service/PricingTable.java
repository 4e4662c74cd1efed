package com.llmrouter.service;

import com.llmrouter.config.GatewayProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Price per 1000 tokens, by provider and model.
 *
 * Lookup order: exact model under the provider, the provider default, the global default.
 */
public class PricingTable {

    private final double defaultRate;
    private final Map<String, GatewayProperties.ProviderPricing> providers;

    public PricingTable(GatewayProperties.Pricing pricing) {
        this.defaultRate = pricing.getDefaultRate();
        this.providers = Collections.unmodifiableMap(new LinkedHashMap<>(pricing.getProviders()));
    }

    public double ratePer1K(String provider, String model) {
        GatewayProperties.ProviderPricing providerPricing = providers.get(provider);
        if (providerPricing == null) {
            return defaultRate;
        }
        Double modelRate = providerPricing.getModels().get(model);
        if (modelRate != null) {
            return modelRate;
        }
        return providerPricing.getDefaultRate() != null ? providerPricing.getDefaultRate() : defaultRate;
    }

    public double cost(String provider, String model, int totalTokens) {
        return totalTokens / 1000.0 * ratePer1K(provider, model);
    }
}

package com.llmrouter.service;

import com.llmrouter.config.GatewayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for PricingTable lookup order.
 */
class PricingTableTest {

    private PricingTable pricingTable;

    @BeforeEach
    void setUp() {
        GatewayProperties.Pricing pricing = new GatewayProperties.Pricing();
        GatewayProperties.ProviderPricing openai = new GatewayProperties.ProviderPricing();
        openai.getModels().put("gpt-4", 0.03);
        openai.getModels().put("gpt-3.5-turbo", 0.0015);
        GatewayProperties.ProviderPricing groq = new GatewayProperties.ProviderPricing();
        groq.setDefaultRate(0.0001);
        pricing.getProviders().put("openai", openai);
        pricing.getProviders().put("groq", groq);
        pricingTable = new PricingTable(pricing);
    }

    @Test
    void ratePer1K_ExactModel() {
        assertThat(pricingTable.ratePer1K("openai", "gpt-4")).isEqualTo(0.03);
    }

    @Test
    void ratePer1K_ProviderDefault() {
        assertThat(pricingTable.ratePer1K("groq", "llama3-8b-8192")).isEqualTo(0.0001);
    }

    @Test
    void ratePer1K_GlobalDefault() {
        assertThat(pricingTable.ratePer1K("openai", "gpt-4o")).isEqualTo(0.001);
        assertThat(pricingTable.ratePer1K("unknown", "model")).isEqualTo(0.001);
    }

    @Test
    void cost_ScalesPerThousandTokens() {
        assertThat(pricingTable.cost("openai", "gpt-4", 30)).isCloseTo(0.0009, within(1e-12));
        assertThat(pricingTable.cost("groq", "llama3-8b-8192", 2500)).isCloseTo(0.00025, within(1e-12));
        assertThat(pricingTable.cost("openai", "gpt-4", 0)).isZero();
    }
}

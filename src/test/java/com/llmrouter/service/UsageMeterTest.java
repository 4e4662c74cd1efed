package com.llmrouter.service;

import com.llmrouter.config.GatewayProperties;
import com.llmrouter.model.dto.ProviderUsage;
import com.llmrouter.model.entity.UsageRecord;
import com.llmrouter.model.upstream.Usage;
import com.llmrouter.repository.UsageRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for UsageMeter.
 */
@ExtendWith(MockitoExtension.class)
class UsageMeterTest {

    @Mock
    private UsageRecordRepository usageRecordRepository;

    private UsageMeter usageMeter;

    @BeforeEach
    void setUp() {
        GatewayProperties.Pricing pricing = new GatewayProperties.Pricing();
        GatewayProperties.ProviderPricing openai = new GatewayProperties.ProviderPricing();
        openai.getModels().put("gpt-4", 0.03);
        pricing.getProviders().put("openai", openai);
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        usageMeter = new UsageMeter(usageRecordRepository, new PricingTable(pricing), clock);
    }

    @Test
    void record_PersistsTokensAndCost() {
        when(usageRecordRepository.save(any(UsageRecord.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        StepVerifier.create(usageMeter.record("ak_1", "openai", "gpt-4", "/v1/chat/completions", new Usage(10, 20, 30)))
                .verifyComplete();

        ArgumentCaptor<UsageRecord> saved = ArgumentCaptor.forClass(UsageRecord.class);
        verify(usageRecordRepository).save(saved.capture());
        UsageRecord record = saved.getValue();
        assertThat(record.getId()).matches("log_[0-9a-f]{16}");
        assertThat(record.isNew()).isTrue();
        assertThat(record.getApiKeyId()).isEqualTo("ak_1");
        assertThat(record.getPromptTokens()).isEqualTo(10);
        assertThat(record.getCompletionTokens()).isEqualTo(20);
        assertThat(record.getTotalTokens()).isEqualTo(30);
        assertThat(record.getCost()).isCloseTo(0.0009, within(1e-12));
        assertThat(record.getTimestamp()).isEqualTo(LocalDateTime.of(2024, 5, 1, 10, 0));
    }

    @Test
    void record_AbsorbsPersistenceFailure() {
        when(usageRecordRepository.save(any(UsageRecord.class)))
                .thenReturn(Mono.error(new IllegalStateException("database unavailable")));

        StepVerifier.create(usageMeter.record("ak_1", "openai", "gpt-4", "/v1/chat/completions", new Usage(1, 1, 2)))
                .verifyComplete();
    }

    @Test
    void summarize_AggregatesPerProvider() {
        when(usageRecordRepository.findByApiKeyId("ak_1")).thenReturn(Flux.just(
                record("openai", 30, 0.0009),
                record("openai", 70, 0.0021),
                record("groq", 1000, 0.0001)));

        StepVerifier.create(usageMeter.summarize("ak_1"))
                .assertNext(usage -> {
                    assertThat(usage.getApiKeyId()).isEqualTo("ak_1");
                    assertThat(usage.getTotalRequests()).isEqualTo(3);
                    assertThat(usage.getTotalTokens()).isEqualTo(1100);
                    assertThat(usage.getTotalCost()).isCloseTo(0.0031, within(1e-12));
                    ProviderUsage openai = usage.getProviderBreakdown().get("openai");
                    assertThat(openai.getRequests()).isEqualTo(2);
                    assertThat(openai.getTokens()).isEqualTo(100);
                    assertThat(openai.getCost()).isCloseTo(0.003, within(1e-12));
                    assertThat(usage.getProviderBreakdown().get("groq").getRequests()).isEqualTo(1);
                })
                .verifyComplete();
    }

    @Test
    void summarize_EmptyHistory() {
        when(usageRecordRepository.findByApiKeyId("ak_new")).thenReturn(Flux.empty());

        StepVerifier.create(usageMeter.summarize("ak_new"))
                .expectNextMatches(usage -> usage.getTotalRequests() == 0
                        && usage.getTotalCost() == 0
                        && usage.getProviderBreakdown().isEmpty())
                .verifyComplete();
    }

    private static UsageRecord record(String provider, int tokens, double cost) {
        return UsageRecord.builder()
                .apiKeyId("ak_1")
                .provider(provider)
                .model("m")
                .totalTokens(tokens)
                .cost(cost)
                .build();
    }
}

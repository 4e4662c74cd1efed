package com.llmrouter.controller;

import com.llmrouter.model.dto.UsageResponse;
import com.llmrouter.model.dto.UsageSummaryResponse;
import com.llmrouter.security.CallerIdentity;
import com.llmrouter.service.UsageMeter;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Usage statistics, scoped to the calling key.
 */
@RestController
@RequestMapping("/v1/usage")
@RequiredArgsConstructor
public class UsageController {

    private final UsageMeter usageMeter;

    @GetMapping
    public Mono<UsageResponse> getUsage(@AuthenticationPrincipal CallerIdentity caller) {
        return usageMeter.summarize(caller.getApiKeyId());
    }

    @GetMapping("/summary")
    public Mono<UsageSummaryResponse> getUsageSummary(@AuthenticationPrincipal CallerIdentity caller) {
        return Mono.just(UsageSummaryResponse.builder()
                .apiKeyId(caller.getApiKeyId())
                .message("Usage tracking is active")
                .rateLimit(caller.getApiKey().getRateLimit())
                .currentUsage(caller.getApiKey().getUsageCount())
                .build());
    }
}

package com.llmrouter.provider;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.List;

/**
 * A registered upstream provider: where to send requests and which models it serves.
 */
@Getter
@Builder
@ToString(exclude = "apiKey")
public class ProviderHandle {
    private final String name;
    private final String baseUrl;
    private final String apiKey;
    private final List<String> models;
    private final Duration timeout;
    private final boolean streamUsage;

    public boolean supports(String model) {
        return models.contains(model);
    }
}

package com.llmrouter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway configuration, bound from {@code gateway.*}.
 *
 * <pre>
 * gateway:
 *   api-key-prefix: llm-router-
 *   providers:
 *     openai:
 *       base-url: https://api.openai.com/v1
 *       api-key: ${OPENAI_API_KEY:}
 *       models: [gpt-4o, gpt-3.5-turbo]
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /** Prefix every issued API key secret starts with */
    private String apiKeyPrefix = "llm-router-";

    /** Informational rate limit stamped on new keys */
    private int defaultRateLimit = 1000;

    private Cache cache = new Cache();

    private Tokens tokens = new Tokens();

    /** Upstream providers, in registration order */
    private Map<String, Provider> providers = new LinkedHashMap<>();

    private Pricing pricing = new Pricing();

    @Data
    public static class Cache {

        /** none | redis */
        private String type = "none";

        private Duration ttl = Duration.ofHours(1);

        private String keyPrefix = "api_key:";
    }

    @Data
    public static class Tokens {

        /** HMAC secret, at least 32 bytes */
        private String secret;

        private Duration defaultTtl = Duration.ofHours(24);

        private Duration minTtl = Duration.ofHours(1);

        private Duration maxTtl = Duration.ofHours(168);
    }

    @Data
    public static class Provider {

        private boolean enabled = true;

        private String baseUrl;

        private String apiKey;

        private List<String> models = new ArrayList<>();

        private Duration timeout = Duration.ofSeconds(60);

        /** Ask the upstream to append a usage figure to the last stream chunk */
        private boolean streamUsage = true;
    }

    @Data
    public static class Pricing {

        /** Price per 1000 tokens when the provider is not listed */
        private double defaultRate = 0.001;

        private Map<String, ProviderPricing> providers = new LinkedHashMap<>();
    }

    @Data
    public static class ProviderPricing {

        /** Price per 1000 tokens for models not listed below; falls back to the global default */
        private Double defaultRate;

        private Map<String, Double> models = new LinkedHashMap<>();
    }
}

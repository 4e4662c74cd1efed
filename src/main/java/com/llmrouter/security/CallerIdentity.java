package com.llmrouter.security;

import com.llmrouter.model.entity.ApiKey;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * The authenticated principal: the API key a request acts as, and how it proved it.
 */
@Getter
@ToString(of = {"method", "tokenId"})
@AllArgsConstructor
public class CallerIdentity {

    private final ApiKey apiKey;
    private final Credential.Type method;

    /** Set only for bearer-token callers */
    private final String tokenId;

    public static CallerIdentity viaApiKey(ApiKey apiKey) {
        return new CallerIdentity(apiKey, Credential.Type.API_KEY, null);
    }

    public static CallerIdentity viaToken(ApiKey apiKey, String tokenId) {
        return new CallerIdentity(apiKey, Credential.Type.BEARER_TOKEN, tokenId);
    }

    public String getApiKeyId() {
        return apiKey.getId();
    }
}

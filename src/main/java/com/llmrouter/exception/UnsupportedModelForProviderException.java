package com.llmrouter.exception;

import lombok.Getter;

import java.util.List;

/**
 * A provider was pinned but is not registered, or does not list the model.
 */
@Getter
public class UnsupportedModelForProviderException extends ModelResolutionException {

    private final String provider;
    private final String model;
    private final List<String> providerModels;

    private UnsupportedModelForProviderException(String message, String provider, String model,
                                                 List<String> providerModels) {
        super(message);
        this.provider = provider;
        this.model = model;
        this.providerModels = providerModels;
    }

    public static UnsupportedModelForProviderException notConfigured(String provider, String model) {
        return new UnsupportedModelForProviderException(
                String.format("Provider '%s' not configured or available", provider),
                provider, model, List.of());
    }

    public static UnsupportedModelForProviderException modelNotListed(String provider, String model,
                                                                      List<String> providerModels) {
        return new UnsupportedModelForProviderException(
                String.format("Model '%s' not available for provider '%s'. Available: %s",
                        model, provider, providerModels),
                provider, model, List.copyOf(providerModels));
    }
}

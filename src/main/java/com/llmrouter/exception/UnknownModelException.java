package com.llmrouter.exception;

import lombok.Getter;

import java.util.List;

/**
 * Model is not served by any registered provider.
 */
@Getter
public class UnknownModelException extends ModelResolutionException {

    private final String model;
    private final List<String> knownModels;

    public UnknownModelException(String model, List<String> knownModels) {
        super(String.format("Model '%s' not available. Available models: %s", model, knownModels));
        this.model = model;
        this.knownModels = List.copyOf(knownModels);
    }
}

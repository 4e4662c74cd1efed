package com.llmrouter.provider;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of model resolution: the provider that will serve the model.
 */
@Getter
@ToString
@AllArgsConstructor
public class ResolvedRoute {
    private final ProviderHandle provider;
    private final String model;
}

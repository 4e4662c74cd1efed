package com.llmrouter.provider;

import com.llmrouter.exception.UnknownModelException;
import com.llmrouter.exception.UnsupportedModelForProviderException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registered providers and the model-to-provider index built from them.
 *
 * <p>When two providers list the same model, the one registered later serves it
 * by default; both still list it. Providers that are configured but cannot be
 * routed to (disabled, or missing an API key) are kept for status reporting only.
 * The registry is immutable once built.
 */
@Slf4j
public class ProviderRegistry {

    private final Map<String, ProviderHandle> providers;
    private final Map<String, ProviderHandle> modelIndex;
    private final Map<String, ProviderHandle> unavailable;

    public ProviderRegistry(Collection<ProviderHandle> handles) {
        this(handles, List.of());
    }

    public ProviderRegistry(Collection<ProviderHandle> handles, Collection<ProviderHandle> unavailableHandles) {
        Map<String, ProviderHandle> byName = new LinkedHashMap<>();
        Map<String, ProviderHandle> byModel = new LinkedHashMap<>();
        for (ProviderHandle handle : handles) {
            byName.put(handle.getName(), handle);
            for (String model : handle.getModels()) {
                ProviderHandle previous = byModel.put(model, handle);
                if (previous != null && !previous.getName().equals(handle.getName())) {
                    log.warn("Model {} is listed by both {} and {}; routing it to {}",
                            model, previous.getName(), handle.getName(), handle.getName());
                }
            }
            log.info("Registered provider {} with {} models", handle.getName(), handle.getModels().size());
        }
        this.providers = Collections.unmodifiableMap(byName);
        this.modelIndex = Collections.unmodifiableMap(byModel);

        Map<String, ProviderHandle> skipped = new LinkedHashMap<>();
        for (ProviderHandle handle : unavailableHandles) {
            if (!byName.containsKey(handle.getName())) {
                skipped.put(handle.getName(), handle);
            }
        }
        this.unavailable = Collections.unmodifiableMap(skipped);
    }

    /**
     * Pick the provider for a model.
     *
     * @param model Requested model id
     * @param preferredProvider Optional provider name the caller asked for
     * @throws UnsupportedModelForProviderException if the preferred provider is missing or lacks the model
     * @throws UnknownModelException if no provider serves the model
     */
    public ResolvedRoute resolve(String model, String preferredProvider) {
        if (preferredProvider != null && !preferredProvider.isBlank()) {
            ProviderHandle handle = providers.get(preferredProvider);
            if (handle == null) {
                throw UnsupportedModelForProviderException.notConfigured(preferredProvider, model);
            }
            if (!handle.supports(model)) {
                throw UnsupportedModelForProviderException.modelNotListed(preferredProvider, model, handle.getModels());
            }
            return new ResolvedRoute(handle, model);
        }

        ProviderHandle handle = modelIndex.get(model);
        if (handle == null) {
            throw new UnknownModelException(model, knownModels());
        }
        return new ResolvedRoute(handle, model);
    }

    public Optional<ProviderHandle> findProviderForModel(String model) {
        return Optional.ofNullable(modelIndex.get(model));
    }

    /**
     * Each registered provider's full catalog, in registration order.
     */
    public Map<String, List<String>> listModels() {
        Map<String, List<String>> catalog = new LinkedHashMap<>();
        providers.forEach((name, handle) -> catalog.put(name, handle.getModels()));
        return catalog;
    }

    public Map<String, ProviderHandle> listProviders() {
        return providers;
    }

    /**
     * Providers present in configuration that were not registered.
     */
    public Map<String, ProviderHandle> listUnavailableProviders() {
        return unavailable;
    }

    public List<String> knownModels() {
        return new ArrayList<>(modelIndex.keySet());
    }
}

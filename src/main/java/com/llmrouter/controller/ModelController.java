package com.llmrouter.controller;

import com.llmrouter.exception.ResourceNotFoundException;
import com.llmrouter.model.dto.ModelInfo;
import com.llmrouter.model.dto.ModelListResponse;
import com.llmrouter.model.dto.ProviderInfo;
import com.llmrouter.model.dto.ProviderListResponse;
import com.llmrouter.provider.ProviderHandle;
import com.llmrouter.provider.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Controller for listing routable models and registered providers.
 */
@RestController
@RequestMapping("/v1/models")
@RequiredArgsConstructor
public class ModelController {

    private final ProviderRegistry providerRegistry;

    @GetMapping
    public Mono<ModelListResponse> listModels() {
        Map<String, ProviderHandle> providers = providerRegistry.listProviders();
        List<ModelInfo> models = providerRegistry.listModels().entrySet().stream()
                .flatMap(entry -> entry.getValue().stream()
                        .map(model -> modelInfo(model, providers.get(entry.getKey()))))
                .collect(Collectors.toList());
        return Mono.just(ModelListResponse.builder().data(models).build());
    }

    @GetMapping("/providers")
    public Mono<ProviderListResponse> listProviders() {
        Map<String, ProviderInfo> providers = new LinkedHashMap<>();
        providerRegistry.listProviders().forEach((name, handle) -> providers.put(name, providerInfo(handle, true)));
        providerRegistry.listUnavailableProviders()
                .forEach((name, handle) -> providers.put(name, providerInfo(handle, false)));
        return Mono.just(ProviderListResponse.builder().data(providers).build());
    }

    @GetMapping("/{modelId}")
    public Mono<ModelInfo> getModel(@PathVariable String modelId) {
        return Mono.justOrEmpty(providerRegistry.findProviderForModel(modelId))
                .map(handle -> modelInfo(modelId, handle))
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException(String.format(
                        "Model '%s' not found. Available models: %s", modelId, providerRegistry.knownModels()))));
    }

    private ProviderInfo providerInfo(ProviderHandle handle, boolean enabled) {
        return ProviderInfo.builder()
                .name(handle.getName())
                .enabled(enabled)
                .models(handle.getModels())
                .modelCount(handle.getModels().size())
                .baseUrl(handle.getBaseUrl())
                .build();
    }

    private ModelInfo modelInfo(String model, ProviderHandle handle) {
        return ModelInfo.builder()
                .id(model)
                .provider(handle.getName())
                .ownedBy(handle.getName())
                .build();
    }
}

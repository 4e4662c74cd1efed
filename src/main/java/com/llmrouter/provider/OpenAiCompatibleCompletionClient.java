package com.llmrouter.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmrouter.exception.UpstreamFailureException;
import com.llmrouter.model.upstream.CompletionChunk;
import com.llmrouter.model.upstream.CompletionRequest;
import com.llmrouter.model.upstream.CompletionResult;
import com.llmrouter.model.upstream.Usage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Client for providers exposing the OpenAI {@code /chat/completions} protocol
 * (OpenAI itself, Groq, Gemini's OpenAI-compatible endpoint).
 */
@Slf4j
@Component
public class OpenAiCompatibleCompletionClient implements CompletionClient {

    private static final String COMPLETIONS_PATH = "/chat/completions";
    private static final String DONE_SENTINEL = "[DONE]";
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;
    private final Map<String, WebClient> clients = new ConcurrentHashMap<>();

    public OpenAiCompatibleCompletionClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.webClientBuilder = webClientBuilder;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<CompletionResult> complete(ProviderHandle provider, CompletionRequest request) {
        return client(provider).post()
                .uri(COMPLETIONS_PATH)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + provider.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody(provider, request, false))
                .retrieve()
                .bodyToMono(CompletionResult.class)
                .timeout(provider.getTimeout())
                .map(result -> {
                    if (result.getUsage() == null) {
                        result.setUsage(Usage.empty());
                    }
                    return result;
                })
                .onErrorMap(e -> !(e instanceof UpstreamFailureException), e -> toUpstreamFailure(provider, e));
    }

    @Override
    public Flux<CompletionChunk> stream(ProviderHandle provider, CompletionRequest request) {
        return client(provider).post()
                .uri(COMPLETIONS_PATH)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + provider.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(requestBody(provider, request, true))
                .retrieve()
                .bodyToFlux(SSE_TYPE)
                .timeout(provider.getTimeout())
                .map(ServerSentEvent::data)
                .filter(data -> data != null && !data.isBlank())
                .takeWhile(data -> !DONE_SENTINEL.equals(data.trim()))
                .map(data -> decodeChunk(provider, data))
                .onErrorMap(e -> !(e instanceof UpstreamFailureException), e -> toUpstreamFailure(provider, e));
    }

    Map<String, Object> requestBody(ProviderHandle provider, CompletionRequest request, boolean stream) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", request.getModel());
        body.put("messages", request.getMessages());
        body.put("max_tokens", request.getMaxTokens());
        body.put("temperature", request.getTemperature());
        if (request.getTopP() != null) {
            body.put("top_p", request.getTopP());
        }
        body.put("stream", stream);
        if (stream && provider.isStreamUsage()) {
            body.put("stream_options", Map.of("include_usage", true));
        }
        return body;
    }

    private CompletionChunk decodeChunk(ProviderHandle provider, String data) {
        try {
            return objectMapper.readValue(data, CompletionChunk.class);
        } catch (JsonProcessingException e) {
            throw new UpstreamFailureException(provider.getName(),
                    "Malformed stream chunk from " + provider.getName() + ": " + e.getOriginalMessage(), e);
        }
    }

    private UpstreamFailureException toUpstreamFailure(ProviderHandle provider, Throwable error) {
        String message;
        if (error instanceof WebClientResponseException) {
            WebClientResponseException responseError = (WebClientResponseException) error;
            message = String.format("%s returned %d: %s", provider.getName(),
                    responseError.getStatusCode().value(), responseError.getResponseBodyAsString());
        } else if (error instanceof TimeoutException) {
            message = String.format("%s did not respond within %s", provider.getName(), provider.getTimeout());
        } else {
            message = String.format("%s request failed: %s", provider.getName(), error.getMessage());
        }
        log.error("Upstream call to {} failed: {}", provider.getName(), message);
        return new UpstreamFailureException(provider.getName(), message, error);
    }

    private WebClient client(ProviderHandle provider) {
        return clients.computeIfAbsent(provider.getName(),
                name -> webClientBuilder.clone().baseUrl(provider.getBaseUrl()).build());
    }
}

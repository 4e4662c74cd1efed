package com.llmrouter.service;

import com.llmrouter.exception.ErrorKind;
import com.llmrouter.exception.UpstreamFailureException;
import com.llmrouter.model.dto.ChatCompletionChunk;
import com.llmrouter.model.dto.ChatCompletionRequest;
import com.llmrouter.model.dto.ChatCompletionResponse;
import com.llmrouter.model.upstream.ChatDelta;
import com.llmrouter.model.upstream.ChunkChoice;
import com.llmrouter.model.upstream.CompletionChunk;
import com.llmrouter.model.upstream.CompletionRequest;
import com.llmrouter.model.upstream.CompletionResult;
import com.llmrouter.model.upstream.Usage;
import com.llmrouter.provider.CompletionClient;
import com.llmrouter.provider.ProviderRegistry;
import com.llmrouter.provider.ResolvedRoute;
import com.llmrouter.security.CallerIdentity;
import com.llmrouter.util.ApiKeyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Routes an authenticated chat completion to its provider and meters the result.
 *
 * <p>Streams end with exactly one terminal frame: the {@code [DONE]} sentinel
 * on success, an error frame on upstream failure. Usage reported by the upstream
 * is recorded once per stream, also when the stream fails or the caller cancels.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompletionGateway {

    static final String ENDPOINT = "/v1/chat/completions";

    private final ProviderRegistry providerRegistry;
    private final CompletionClient completionClient;
    private final UsageMeter usageMeter;
    private final Clock clock;

    /**
     * Buffered completion.
     *
     * @return the response, or a {@link com.llmrouter.exception.ModelResolutionException} before any
     * upstream call, or {@link UpstreamFailureException}
     */
    public Mono<ChatCompletionResponse> complete(CallerIdentity caller, ChatCompletionRequest request) {
        return Mono.fromCallable(() -> providerRegistry.resolve(request.getModel(), request.getProvider()))
                .doOnNext(route -> log.info("Routing {} for key {} to {}",
                        route.getModel(), caller.getApiKeyId(), route.getProvider().getName()))
                .flatMap(route -> completionClient.complete(route.getProvider(), toUpstream(request, route, false))
                        .onErrorMap(e -> !(e instanceof UpstreamFailureException),
                                e -> new UpstreamFailureException(route.getProvider().getName(), e.getMessage(), e))
                        .map(result -> toResponse(result, route))
                        .flatMap(response -> usageMeter.record(caller.getApiKeyId(),
                                        route.getProvider().getName(), route.getModel(), ENDPOINT, response.getUsage())
                                .thenReturn(response)));
    }

    /**
     * Streamed completion. Model resolution happens before the returned flux is
     * handed out, so routing errors surface as a failed Mono rather than a stream.
     */
    public Mono<Flux<StreamFrame>> openStream(CallerIdentity caller, ChatCompletionRequest request) {
        return Mono.fromCallable(() -> providerRegistry.resolve(request.getModel(), request.getProvider()))
                .doOnNext(route -> log.info("Streaming {} for key {} from {}",
                        route.getModel(), caller.getApiKeyId(), route.getProvider().getName()))
                .map(route -> streamFrames(caller, request, route));
    }

    private Flux<StreamFrame> streamFrames(CallerIdentity caller, ChatCompletionRequest request, ResolvedRoute route) {
        String provider = route.getProvider().getName();
        AtomicReference<Usage> usage = new AtomicReference<>();
        AtomicBoolean metered = new AtomicBoolean();

        Mono<Void> meterOnce = Mono.defer(() -> {
            Usage captured = usage.get();
            if (captured == null || !metered.compareAndSet(false, true)) {
                return Mono.empty();
            }
            return usageMeter.record(caller.getApiKeyId(), provider, route.getModel(), ENDPOINT, captured);
        });

        return completionClient.stream(route.getProvider(), toUpstream(request, route, true))
                .doOnNext(chunk -> {
                    if (chunk.getUsage() != null) {
                        usage.set(chunk.getUsage());
                    }
                })
                .filter(CompletionChunk::hasChoices)
                .map(chunk -> StreamFrame.chunk(toEnvelope(chunk, route)))
                .concatWith(meterOnce.then(Mono.fromSupplier(StreamFrame::done)))
                .onErrorResume(e -> {
                    String message = e instanceof UpstreamFailureException
                            ? e.getMessage()
                            : provider + " stream failed: " + e.getMessage();
                    log.error("Stream from {} for key {} failed: {}", provider, caller.getApiKeyId(), message);
                    return meterOnce.then(Mono.just(StreamFrame.error(ErrorKind.UPSTREAM_FAILURE, message)));
                })
                .doOnCancel(() -> {
                    log.info("Caller cancelled stream from {} for key {}", provider, caller.getApiKeyId());
                    meterOnce.subscribe();
                });
    }

    private CompletionRequest toUpstream(ChatCompletionRequest request, ResolvedRoute route, boolean stream) {
        return CompletionRequest.builder()
                .model(route.getModel())
                .messages(request.getMessages())
                .maxTokens(request.getMaxTokens())
                .temperature(request.getTemperature())
                .topP(request.getTopP())
                .stream(stream)
                .build();
    }

    private ChatCompletionResponse toResponse(CompletionResult result, ResolvedRoute route) {
        return ChatCompletionResponse.builder()
                .id(result.getId() != null ? result.getId() : "chatcmpl-" + ApiKeyUtil.randomHex(12))
                .created(result.getCreated() > 0 ? result.getCreated() : clock.instant().getEpochSecond())
                .model(route.getModel())
                .provider(route.getProvider().getName())
                .choices(result.getChoices() != null ? result.getChoices() : List.of())
                .usage(result.getUsage() != null ? result.getUsage() : Usage.empty())
                .build();
    }

    private ChatCompletionChunk toEnvelope(CompletionChunk chunk, ResolvedRoute route) {
        List<ChunkChoice> choices = chunk.getChoices().stream()
                .map(choice -> ChunkChoice.builder()
                        .index(choice.getIndex())
                        .delta(choice.getDelta() != null ? choice.getDelta() : new ChatDelta())
                        .finishReason(choice.getFinishReason())
                        .build())
                .collect(Collectors.toList());
        return ChatCompletionChunk.builder()
                .id(chunk.getId())
                .created(chunk.getCreated())
                .model(chunk.getModel() != null ? chunk.getModel() : route.getModel())
                .provider(route.getProvider().getName())
                .choices(choices)
                .build();
    }
}

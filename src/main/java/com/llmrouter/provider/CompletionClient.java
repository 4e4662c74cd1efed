package com.llmrouter.provider;

import com.llmrouter.model.upstream.CompletionChunk;
import com.llmrouter.model.upstream.CompletionRequest;
import com.llmrouter.model.upstream.CompletionResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Talks to an upstream provider.
 *
 * Implementations signal failures as {@link com.llmrouter.exception.UpstreamFailureException}.
 */
public interface CompletionClient {

    /**
     * Request a complete answer. The result always carries a usage figure, zero when the upstream omits it.
     */
    Mono<CompletionResult> complete(ProviderHandle provider, CompletionRequest request);

    /**
     * Request a streamed answer. Chunks arrive in upstream order; cancelling the
     * returned flux cancels the upstream request.
     */
    Flux<CompletionChunk> stream(ProviderHandle provider, CompletionRequest request);
}

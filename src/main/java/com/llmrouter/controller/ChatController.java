package com.llmrouter.controller;

import com.llmrouter.model.dto.ChatCompletionRequest;
import com.llmrouter.security.CallerIdentity;
import com.llmrouter.service.CompletionGateway;
import com.llmrouter.service.StreamFrame;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OpenAI-compatible chat completions, buffered or streamed as server-sent events.
 */
@RestController
@RequestMapping("/v1/chat")
@RequiredArgsConstructor
public class ChatController {

    static final String DONE = "[DONE]";

    private final CompletionGateway completionGateway;

    @PostMapping("/completions")
    public Mono<ResponseEntity<?>> chatCompletions(
            @AuthenticationPrincipal CallerIdentity caller,
            @Valid @RequestBody ChatCompletionRequest request) {
        if (request.isStream()) {
            return completionGateway.openStream(caller, request)
                    .<ResponseEntity<?>>map(frames -> ResponseEntity.ok()
                            .contentType(MediaType.TEXT_EVENT_STREAM)
                            .body(frames.map(ChatController::toEvent)));
        }
        return completionGateway.complete(caller, request)
                .<ResponseEntity<?>>map(response -> ResponseEntity.ok()
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(response));
    }

    static ServerSentEvent<Object> toEvent(StreamFrame frame) {
        switch (frame.getType()) {
            case CHUNK:
                return ServerSentEvent.<Object>builder(frame.getChunk()).build();
            case DONE:
                return ServerSentEvent.<Object>builder(DONE).build();
            default:
                Map<String, Object> error = new LinkedHashMap<>();
                error.put("kind", frame.getErrorKind());
                error.put("message", frame.getErrorMessage());
                return ServerSentEvent.<Object>builder(Map.of("error", error)).build();
        }
    }
}

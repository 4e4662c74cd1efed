package com.llmrouter.model.upstream;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Normalized completion request handed to a {@link com.llmrouter.provider.CompletionClient}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionRequest {
    private String model;
    private List<ChatMessage> messages;
    private Integer maxTokens;
    private Double temperature;
    private Double topP;
    private boolean stream;
}

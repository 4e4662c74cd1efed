package com.llmrouter.model.dto;

import com.llmrouter.model.upstream.CompletionChoice;
import com.llmrouter.model.upstream.Usage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatCompletionResponse {
    private String id;
    @Builder.Default
    private String object = "chat.completion";
    private long created;
    private String model;
    private String provider;
    private List<CompletionChoice> choices;
    private Usage usage;
}

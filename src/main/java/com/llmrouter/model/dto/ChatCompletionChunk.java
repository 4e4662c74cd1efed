package com.llmrouter.model.dto;

import com.llmrouter.model.upstream.ChunkChoice;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One streamed completion chunk as forwarded to the caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatCompletionChunk {
    private String id;
    @Builder.Default
    private String object = "chat.completion.chunk";
    private long created;
    private String model;
    private String provider;
    private List<ChunkChoice> choices;
}

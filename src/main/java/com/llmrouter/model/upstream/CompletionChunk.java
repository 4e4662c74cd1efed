package com.llmrouter.model.upstream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One server-sent event of a streaming completion. The final chunk may carry
 * usage and no choices.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompletionChunk {
    private String id;
    private long created;
    private String model;
    private List<ChunkChoice> choices;
    private Usage usage;

    public boolean hasChoices() {
        return choices != null && !choices.isEmpty();
    }
}

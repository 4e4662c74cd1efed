package com.llmrouter.model.upstream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Incremental message content carried by a stream chunk. Role and content are
 * always serialized, as null when the upstream left them out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatDelta {
    private String role;
    private String content;
}

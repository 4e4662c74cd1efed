package com.llmrouter.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cached liveness snapshot of an API key, keyed by secret hash.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedKey {
    private String id;
    private String name;
    private boolean active;
}

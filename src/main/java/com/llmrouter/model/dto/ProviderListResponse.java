package com.llmrouter.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderListResponse {
    @Builder.Default
    private String object = "list";
    private Map<String, ProviderInfo> data;
}

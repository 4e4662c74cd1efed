package com.llmrouter.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderInfo {
    private String name;
    private boolean enabled;
    private List<String> models;
    private int modelCount;
    private String baseUrl;
}

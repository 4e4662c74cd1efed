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
public class ModelListResponse {
    @Builder.Default
    private String object = "list";
    private List<ModelInfo> data;
}

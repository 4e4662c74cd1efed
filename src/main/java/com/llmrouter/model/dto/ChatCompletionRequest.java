package com.llmrouter.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.llmrouter.model.upstream.ChatMessage;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OpenAI-style chat completion request, with an optional provider pin.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatCompletionRequest {

    @NotBlank(message = "Model is required")
    private String model;

    @NotEmpty(message = "Messages must not be empty")
    @Valid
    private List<ChatMessage> messages;

    @Min(1)
    @Builder.Default
    @JsonProperty("max_tokens")
    private Integer maxTokens = 150;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    @Builder.Default
    private Double temperature = 0.7;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Builder.Default
    @JsonProperty("top_p")
    private Double topP = 1.0;

    @Builder.Default
    private boolean stream = false;

    /** Route to this provider instead of the one the model index picks */
    private String provider;
}

package com.synthgen.perftuner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of POST /v1/chat/completions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionRequest {

    private String model;

    private List<ChatMessage> messages;

    @JsonProperty("max_tokens")
    private int maxTokens;

    private double temperature;
}

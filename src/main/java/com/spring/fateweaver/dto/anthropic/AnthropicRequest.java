package com.spring.fateweaver.dto.anthropic;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Anthropic Messages API 요청 DTO
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnthropicRequest(
    String model,
    @JsonProperty("max_tokens") int maxTokens,
    String system,
    List<Message> messages,
    Double temperature
) {
    public record Message(String role, String content) {}
}

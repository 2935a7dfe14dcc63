package com.spring.fateweaver.dto.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * OpenAI ChatCompletion 요청 DTO
 * - jsonMode 이면 response_format = {"type": "json_object"}
 * - null 필드는 직렬화에서 제외
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OpenAiChatRequest(
    String model,
    List<OpenAiMessage> messages,
    Double temperature,
    @JsonProperty("max_tokens") Integer maxTokens,
    @JsonProperty("response_format") Map<String, String> responseFormat
) {
    public static OpenAiChatRequest of(String model, List<OpenAiMessage> messages,
                                       double temperature, Integer maxTokens, boolean jsonMode) {
        return new OpenAiChatRequest(model, messages, temperature, maxTokens,
            jsonMode ? Map.of("type", "json_object") : null);
    }
}

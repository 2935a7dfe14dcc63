package com.spring.fateweaver.dto.gemini;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Gemini generateContent 요청 DTO
 * - 대화 role 은 user / model
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GeminiRequest(
    Content systemInstruction,
    List<Content> contents,
    GenerationConfig generationConfig
) {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Content(String role, List<Part> parts) {
        public static Content of(String role, String text) {
            return new Content(role, List.of(new Part(text)));
        }
    }

    public record Part(String text) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GenerationConfig(Double temperature, Integer maxOutputTokens, String responseMimeType) {}
}

package com.spring.fateweaver.dto.gemini;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Gemini generateContent 응답 DTO
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeminiResponse(
    List<Candidate> candidates,
    UsageMetadata usageMetadata
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Candidate(Content content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Content(String role, List<Part> parts) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Part(String text) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UsageMetadata(int promptTokenCount, int candidatesTokenCount) {}

    public String text() {
        if (candidates == null || candidates.isEmpty()) return null;
        Content content = candidates.get(0).content();
        if (content == null || content.parts() == null) return null;
        String joined = content.parts().stream()
            .map(Part::text)
            .filter(t -> t != null)
            .collect(Collectors.joining());
        return joined.isEmpty() ? null : joined;
    }
}

package com.spring.fateweaver.dto.anthropic;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Anthropic Messages API 응답 DTO
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnthropicResponse(
    List<ContentBlock> content,
    Usage usage
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ContentBlock(String type, String text) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Usage(
        @JsonProperty("input_tokens") int inputTokens,
        @JsonProperty("output_tokens") int outputTokens
    ) {}

    /** text 블록들을 이어붙인 본문. 없으면 null */
    public String text() {
        if (content == null || content.isEmpty()) return null;
        String joined = content.stream()
            .filter(block -> "text".equals(block.type()) && block.text() != null)
            .map(ContentBlock::text)
            .collect(Collectors.joining());
        return joined.isEmpty() ? null : joined;
    }
}

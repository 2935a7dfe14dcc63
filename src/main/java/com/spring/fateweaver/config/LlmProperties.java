package com.spring.fateweaver.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * LLM 프로바이더/모델 라우팅 설정
 *
 * @param modelAliases UI 모델 id → 프로바이더 모델 id (예: claude-sonnet-3.5 → claude-3-5-sonnet-20241022)
 * @param fallbackModel 자격증명이 없을 때 대체 모델 (서버 OpenAI 키 사용)
 */
@ConfigurationProperties(prefix = "llm")
public record LlmProperties(
    ProviderSettings openai,
    ProviderSettings anthropic,
    ProviderSettings google,
    String brainModel,
    String voiceModel,
    String reviewerModel,
    String fallbackModel,
    Map<String, String> modelAliases
) {
    public record ProviderSettings(String apiKey, String baseUrl, String apiVersion) {
        public boolean hasKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public Map<String, String> aliases() {
        return modelAliases == null ? Map.of() : modelAliases;
    }
}

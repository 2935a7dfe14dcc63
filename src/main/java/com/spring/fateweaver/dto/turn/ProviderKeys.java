package com.spring.fateweaver.dto.turn;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.spring.fateweaver.domain.enums.ProviderType;

/**
 * 사용자 제공(BYOK) API 키. 모두 선택 사항
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderKeys(String openai, String anthropic, String google) {

    public static ProviderKeys none() {
        return new ProviderKeys(null, null, null);
    }

    public String keyFor(ProviderType provider) {
        String key = switch (provider) {
            case OPENAI -> openai;
            case ANTHROPIC -> anthropic;
            case GOOGLE -> google;
        };
        return key == null || key.isBlank() ? null : key;
    }

    @Override
    public String toString() {
        return "ProviderKeys[openai=" + mask(openai) + ", anthropic=" + mask(anthropic) + ", google=" + mask(google) + "]";
    }

    private static String mask(String key) {
        return key == null || key.isBlank() ? "none" : "***";
    }
}

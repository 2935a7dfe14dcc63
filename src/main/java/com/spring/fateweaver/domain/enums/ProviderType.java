package com.spring.fateweaver.domain.enums;

import java.util.Locale;

public enum ProviderType {
    OPENAI,
    ANTHROPIC,
    GOOGLE;

    /** 모델 id 접두사로 프로바이더 추론 (claude → Anthropic, gemini → Google, 그 외 OpenAI) */
    public static ProviderType fromModelId(String modelId) {
        String id = modelId == null ? "" : modelId.toLowerCase(Locale.ROOT);
        if (id.startsWith("claude")) return ANTHROPIC;
        if (id.startsWith("gemini")) return GOOGLE;
        return OPENAI;
    }
}

package com.spring.fateweaver.external.llm;

import com.spring.fateweaver.config.LlmProperties;
import com.spring.fateweaver.domain.enums.ProviderType;
import com.spring.fateweaver.dto.turn.ProviderKeys;
import com.spring.fateweaver.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 모델 라우팅
 * 1. UI id → 실제 모델 id (alias 없으면 그대로)
 * 2. 프로바이더 추론 (접두사)
 * 3. 키: BYOK → 서버 키 → OpenAI fallback 모델
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ModelRouter {

    private final LlmProperties props;

    public ResolvedModel resolve(String requestedId, ProviderKeys keys, String role) {
        String uiId = requestedId == null || requestedId.isBlank() ? props.fallbackModel() : requestedId;
        String modelId = props.aliases().getOrDefault(uiId, uiId);
        ProviderType provider = ProviderType.fromModelId(modelId);

        String byokKey = keys == null ? null : keys.keyFor(provider);
        if (byokKey != null) {
            return new ResolvedModel(uiId, modelId, provider, byokKey, true, false);
        }

        LlmProperties.ProviderSettings settings = settingsFor(provider);
        if (settings != null && settings.hasKey()) {
            return new ResolvedModel(uiId, modelId, provider, settings.apiKey(), false, false);
        }

        // 자격증명 없음 → OpenAI fallback
        String fallbackId = props.aliases().getOrDefault(props.fallbackModel(), props.fallbackModel());
        String openAiKey = keys == null ? null : keys.keyFor(ProviderType.OPENAI);
        if (openAiKey == null && props.openai() != null && props.openai().hasKey()) {
            openAiKey = props.openai().apiKey();
        }
        if (openAiKey == null || fallbackId == null) {
            throw new ConfigurationException("No API key available for the " + role + " model (" + uiId + ").");
        }

        log.warn("⚠️ [ROUTER] No {} credential for {} model {}, falling back to {}", provider, role, uiId, fallbackId);
        return new ResolvedModel(uiId, fallbackId, ProviderType.OPENAI, openAiKey,
            keys != null && keys.keyFor(ProviderType.OPENAI) != null, true);
    }

    public LlmProperties.ProviderSettings settingsFor(ProviderType provider) {
        return switch (provider) {
            case OPENAI -> props.openai();
            case ANTHROPIC -> props.anthropic();
            case GOOGLE -> props.google();
        };
    }
}

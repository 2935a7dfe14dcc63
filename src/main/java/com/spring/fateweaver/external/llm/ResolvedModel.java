package com.spring.fateweaver.external.llm;

import com.spring.fateweaver.domain.enums.ProviderType;

/**
 * 라우팅이 끝난 모델
 *
 * @param requestedId 사용자가 고른 UI 모델 id
 * @param modelId     프로바이더에 보낼 실제 모델 id
 * @param byok        사용자 제공 키 사용 여부
 * @param fallback    자격증명이 없어 대체 모델로 전환되었는지
 */
public record ResolvedModel(
    String requestedId,
    String modelId,
    ProviderType provider,
    String apiKey,
    boolean byok,
    boolean fallback
) {
    /** 토큰 집계용 키 (점은 밑줄로) */
    public String usageKey() {
        return modelId.replace('.', '_');
    }

    @Override
    public String toString() {
        return "ResolvedModel[" + requestedId + " -> " + provider + "/" + modelId
            + (byok ? ", byok" : "") + (fallback ? ", fallback" : "") + "]";
    }
}

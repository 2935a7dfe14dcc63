package com.spring.fateweaver.external.llm;

import com.spring.fateweaver.domain.enums.ProviderType;

/**
 * LLM 프로바이더 하나 + 모델 하나에 바인딩된 호출기
 * - (프롬프트, 대화 기록, 플레이어 행동) → (원문, 토큰 사용량)
 * - 빈 응답이나 호출 실패는 ProviderFailureException
 */
public interface LlmProvider {

    ProviderType type();

    String model();

    LlmCompletion complete(LlmRequest request);
}

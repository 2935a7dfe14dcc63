package com.spring.fateweaver.service.review;

import com.spring.fateweaver.external.llm.ResolvedModel;
import com.spring.fateweaver.external.llm.TokenUsage;

import java.util.List;
import java.util.Map;

/**
 * @param state       보정이 반영된 상태 (State Merger 결과)
 * @param corrections 정규화된 보정 델타
 * @param model       검토에 사용한 모델 (토큰 집계 키는 Brain/Voice 와 같은 규칙)
 */
public record ReviewOutcome(
    Map<String, Object> state,
    Map<String, Object> corrections,
    List<String> warnings,
    String reasoning,
    TokenUsage usage,
    ResolvedModel model
) {
    public String usageKey() {
        return model.usageKey();
    }
}

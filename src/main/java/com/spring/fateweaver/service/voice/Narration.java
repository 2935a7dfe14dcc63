package com.spring.fateweaver.service.voice;

import com.spring.fateweaver.external.llm.TokenUsage;

/**
 * @param fallback true 면 Voice 호출 실패로 Brain 의 요약 문장을 대신 사용
 */
public record Narration(String text, TokenUsage usage, String modelId, boolean fallback) {}

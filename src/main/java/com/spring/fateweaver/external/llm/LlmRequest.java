package com.spring.fateweaver.external.llm;

import com.spring.fateweaver.dto.turn.ChatMessage;

import java.util.List;

/**
 * 프로바이더 공통 요청
 *
 * @param maxTokens null 이면 프로바이더 기본값
 * @param jsonMode  JSON 객체 응답 강제 (지원하는 프로바이더만)
 */
public record LlmRequest(
    String systemPrompt,
    List<ChatMessage> history,
    String userMessage,
    double temperature,
    Integer maxTokens,
    boolean jsonMode
) {
    public List<ChatMessage> safeHistory() {
        return history == null ? List.of() : history;
    }
}

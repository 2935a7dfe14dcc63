package com.spring.fateweaver.service.prompt;

/**
 * 조립된 Brain 프롬프트 (시스템 + 이번 턴 사용자 메시지)
 */
public record BrainPrompt(String systemPrompt, String userMessage) {}

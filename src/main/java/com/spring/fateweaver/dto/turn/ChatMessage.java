package com.spring.fateweaver.dto.turn;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 최근 대화 기록 한 건. role 은 "user" 또는 "assistant"
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessage(String role, String content) {

    public static ChatMessage user(String content) { return new ChatMessage("user", content); }
    public static ChatMessage assistant(String content) { return new ChatMessage("assistant", content); }

    public boolean isUser() {
        return "user".equalsIgnoreCase(role);
    }
}

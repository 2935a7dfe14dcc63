package com.spring.fateweaver.external.llm;

public record LlmCompletion(String text, TokenUsage usage, String model) {}

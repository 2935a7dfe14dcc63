package com.spring.fateweaver.service.parser;

/**
 * 모델 원문 → JSON 객체 복구 전략
 */
public interface JsonRecoveryStrategy {

    String name();

    ParseResult attempt(String rawText);
}

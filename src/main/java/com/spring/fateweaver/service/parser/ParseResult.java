package com.spring.fateweaver.service.parser;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * 복구 전략 하나의 결과 (성공: JSON 객체 / 실패: 사유)
 */
public final class ParseResult {

    private final ObjectNode value;
    private final String strategy;
    private final String failureReason;

    private ParseResult(ObjectNode value, String strategy, String failureReason) {
        this.value = value;
        this.strategy = strategy;
        this.failureReason = failureReason;
    }

    public static ParseResult success(ObjectNode value, String strategy) {
        return new ParseResult(value, strategy, null);
    }

    public static ParseResult failure(String strategy, String reason) {
        return new ParseResult(null, strategy, reason);
    }

    public boolean isSuccess() {
        return value != null;
    }

    public Optional<ObjectNode> value() {
        return Optional.ofNullable(value);
    }

    public String strategy() {
        return strategy;
    }

    public String failureReason() {
        return failureReason;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success[" + strategy + "]" : "Failure[" + strategy + ": " + failureReason + "]";
    }
}

package com.spring.fateweaver.service.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * 후보 문자열을 JSON 객체로 파싱 (객체가 아니면 실패)
 */
final class JsonCandidates {

    private JsonCandidates() {}

    static ParseResult parseObject(ObjectMapper objectMapper, String candidate, String strategy) {
        if (candidate == null || candidate.isBlank()) {
            return ParseResult.failure(strategy, "no candidate text");
        }
        try {
            JsonNode node = objectMapper.readTree(candidate);
            if (node instanceof ObjectNode object) {
                return ParseResult.success(object, strategy);
            }
            return ParseResult.failure(strategy, "not a JSON object");
        } catch (Exception e) {
            return ParseResult.failure(strategy, e.getClass().getSimpleName() + ": " + firstLine(e.getMessage()));
        }
    }

    private static String firstLine(String message) {
        if (message == null) return "";
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}

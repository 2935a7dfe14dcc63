package com.spring.fateweaver.service.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

/**
 * 첫 '{' 부터 문자열/이스케이프를 고려해 괄호 깊이를 세어 첫 번째 균형 잡힌 객체를 잘라낸다.
 */
@RequiredArgsConstructor
public class BalancedBraceStrategy implements JsonRecoveryStrategy {

    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return "balanced-brace";
    }

    @Override
    public ParseResult attempt(String rawText) {
        if (rawText == null) return ParseResult.failure(name(), "no text");
        int start = rawText.indexOf('{');
        if (start < 0) return ParseResult.failure(name(), "no opening brace");

        int depth = 0;
        boolean inString = false;
        boolean escaped = false;

        for (int i = start; i < rawText.length(); i++) {
            char c = rawText.charAt(i);
            if (escaped) {
                escaped = false;
                continue;
            }
            if (c == '\\' && inString) {
                escaped = true;
                continue;
            }
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (inString) continue;

            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return JsonCandidates.parseObject(objectMapper, rawText.substring(start, i + 1), name());
                }
            }
        }
        return ParseResult.failure(name(), "unbalanced braces");
    }
}

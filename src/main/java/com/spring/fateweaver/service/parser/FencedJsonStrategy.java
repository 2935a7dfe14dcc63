package com.spring.fateweaver.service.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ```json ... ``` 코드 펜스 안쪽(없으면 전체)을 그대로 파싱
 */
@RequiredArgsConstructor
public class FencedJsonStrategy implements JsonRecoveryStrategy {

    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*\\n?([\\s\\S]*?)\\n?```");

    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return "direct";
    }

    @Override
    public ParseResult attempt(String rawText) {
        return JsonCandidates.parseObject(objectMapper, unfence(rawText), name());
    }

    static String unfence(String rawText) {
        if (rawText == null) return null;
        Matcher m = FENCE.matcher(rawText);
        return m.find() ? m.group(1).trim() : rawText.trim();
    }
}

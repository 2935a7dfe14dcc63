package com.spring.fateweaver.service.parser;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 특징 키가 함께 등장하는 {...} 구간을 찾아 파싱
 * 예) "stateUpdates" 와 "narrativeCues" 를 모두 포함하는 가장 넓은 중괄호 구간
 */
public class KeyCooccurrenceStrategy implements JsonRecoveryStrategy {

    private final ObjectMapper objectMapper;
    private final List<Pattern> patterns;

    public KeyCooccurrenceStrategy(ObjectMapper objectMapper, List<List<String>> keyGroups) {
        this.objectMapper = objectMapper;
        this.patterns = keyGroups.stream()
            .map(KeyCooccurrenceStrategy::toPattern)
            .collect(Collectors.toList());
    }

    @Override
    public String name() {
        return "key-cooccurrence";
    }

    @Override
    public ParseResult attempt(String rawText) {
        if (rawText == null) return ParseResult.failure(name(), "no text");
        String text = FencedJsonStrategy.unfence(rawText);

        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                ParseResult result = JsonCandidates.parseObject(objectMapper, m.group(), name());
                if (result.isSuccess()) return result;
            }
        }
        return ParseResult.failure(name(), "no key group matched a parseable object");
    }

    private static Pattern toPattern(List<String> keys) {
        String body = keys.stream()
            .map(k -> "\"" + Pattern.quote(k) + "\"")
            .collect(Collectors.joining("[\\s\\S]*"));
        return Pattern.compile("\\{[\\s\\S]*" + body + "[\\s\\S]*\\}");
    }
}

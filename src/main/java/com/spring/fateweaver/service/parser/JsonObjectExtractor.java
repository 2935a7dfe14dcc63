package com.spring.fateweaver.service.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 복구 전략 체인
 * 1. direct (펜스 제거 후 파싱)
 * 2. key-cooccurrence
 * 3. balanced-brace
 * 모두 실패하면 실패 결과를 반환한다. 추측으로 객체를 만들어내지 않는다.
 */
@Component
@Slf4j
public class JsonObjectExtractor {

    static final List<List<String>> BRAIN_KEY_GROUPS = List.of(
        List.of("stateUpdates", "narrativeCues"),
        List.of("narrativeCues", "diceRolls"),
        List.of("narrativeCue")
    );

    private final List<JsonRecoveryStrategy> strategies;

    @Autowired
    public JsonObjectExtractor(ObjectMapper objectMapper) {
        this(List.of(
            new FencedJsonStrategy(objectMapper),
            new KeyCooccurrenceStrategy(objectMapper, BRAIN_KEY_GROUPS),
            new BalancedBraceStrategy(objectMapper)
        ));
    }

    public JsonObjectExtractor(List<JsonRecoveryStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public ParseResult extract(String rawText) {
        List<String> failures = new ArrayList<>();
        for (JsonRecoveryStrategy strategy : strategies) {
            ParseResult result = strategy.attempt(rawText);
            if (result.isSuccess()) {
                if (!failures.isEmpty()) {
                    log.warn("🩹 [PARSER] Recovered JSON with '{}' after {}", strategy.name(), failures);
                }
                return result;
            }
            failures.add(result.toString());
        }
        log.error("❌ [PARSER] All recovery strategies failed: {} | head={}", failures, head(rawText));
        return ParseResult.failure("chain", String.join("; ", failures));
    }

    private static String head(String text) {
        if (text == null) return "null";
        return text.substring(0, Math.min(200, text.length()));
    }
}

package com.spring.fateweaver.service.parser;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spring.fateweaver.dto.brain.BrainResult;
import com.spring.fateweaver.dto.brain.NarrativeCue;
import com.spring.fateweaver.dto.turn.DiceRoll;
import com.spring.fateweaver.dto.turn.PendingChoice;
import com.spring.fateweaver.dto.turn.PendingRoll;
import com.spring.fateweaver.exception.InvalidResponseException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Brain 응답 파서
 *
 * 1. {@link JsonObjectExtractor} 로 JSON 객체 추출 (실패 → InvalidResponseException)
 * 2. 느슨한 형태 정규화 (문자열 cue → cue 목록, 문자열 systemMessages → 목록, pendingRoll.type 기본값)
 * 3. 스키마 검증. 실패하면 필드별 최선 추출로 대체
 * 4. narrativeCue 는 항상 비어있지 않다.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BrainResponseParser {

    public static final String FALLBACK_CUE = "The action was processed.";

    private final JsonObjectExtractor extractor;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    public BrainResult parse(String rawText) {
        ObjectNode node = extractor.extract(rawText).value()
            .orElseThrow(() -> new InvalidResponseException("Brain response could not be parsed as a JSON object."));

        normalize(node);

        BrainResult result;
        try {
            result = objectMapper.treeToValue(node, BrainResult.class);
            Set<ConstraintViolation<BrainResult>> violations = validator.validate(result);
            if (!violations.isEmpty()) {
                log.warn("🩹 [PARSER] Schema validation failed, extracting field by field: {}", describe(violations));
                result = extractFieldByField(node);
            }
        } catch (Exception e) {
            log.warn("🩹 [PARSER] Typed mapping failed, extracting field by field: {}", e.getMessage());
            result = extractFieldByField(node);
        }

        return finish(result);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  정규화
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    private void normalize(ObjectNode node) {
        JsonNode cues = node.get("narrativeCues");
        if (cues != null && cues.isTextual()) {
            node.set("narrativeCues", JsonNodeFactory.instance.arrayNode().add(cueNode(cues.asText())));
        } else if (cues != null && cues.isArray()) {
            ArrayNode normalized = JsonNodeFactory.instance.arrayNode();
            cues.forEach(cue -> normalized.add(cue.isTextual() ? cueNode(cue.asText()) : cue));
            node.set("narrativeCues", normalized);
        }

        JsonNode messages = node.get("systemMessages");
        if (messages != null && messages.isTextual()) {
            node.set("systemMessages", JsonNodeFactory.instance.arrayNode().add(messages.asText()));
        }

        JsonNode roll = node.get("pendingRoll");
        if (roll instanceof ObjectNode rollObject && !rollObject.hasNonNull("type")) {
            rollObject.put("type", PendingRoll.DEFAULT_TYPE);
        }

        if (node.get("stateUpdates") == null || !node.get("stateUpdates").isObject()) {
            node.set("stateUpdates", JsonNodeFactory.instance.objectNode());
        }
        if (node.get("narrativeCues") == null || !node.get("narrativeCues").isArray()) {
            node.set("narrativeCues", JsonNodeFactory.instance.arrayNode());
        }
    }

    private ObjectNode cueNode(String content) {
        ObjectNode cue = JsonNodeFactory.instance.objectNode();
        cue.put("type", "description");
        cue.put("content", content);
        return cue;
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  필드별 최선 추출
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    private BrainResult extractFieldByField(ObjectNode node) {
        Map<String, Object> stateUpdates = convert(node.get("stateUpdates"),
            new TypeReference<Map<String, Object>>() {}, new LinkedHashMap<>());

        List<NarrativeCue> cues = validElements(node.get("narrativeCues"), NarrativeCue.class);
        List<DiceRoll> rolls = validElements(node.get("diceRolls"), DiceRoll.class);

        List<String> systemMessages = new ArrayList<>();
        JsonNode messages = node.get("systemMessages");
        if (messages != null && messages.isArray()) {
            messages.forEach(m -> {
                if (m.isValueNode() && !m.asText().isBlank()) systemMessages.add(m.asText());
            });
        }

        JsonNode cueText = node.get("narrativeCue");
        String narrativeCue = cueText != null && cueText.isTextual() ? cueText.asText() : null;

        PendingChoice choice = validOrNull(node.get("pendingChoice"), PendingChoice.class);
        PendingRoll roll = convert(node.get("pendingRoll"), new TypeReference<PendingRoll>() {}, null);
        boolean requiresUserInput = node.path("requiresUserInput").asBoolean(false);

        return new BrainResult(stateUpdates, cues, rolls, systemMessages, narrativeCue,
            requiresUserInput, choice, roll);
    }

    private <T> List<T> validElements(JsonNode array, Class<T> type) {
        List<T> result = new ArrayList<>();
        if (array == null || !array.isArray()) return result;
        for (JsonNode element : array) {
            T value = validOrNull(element, type);
            if (value != null) {
                result.add(value);
            } else {
                log.warn("🩹 [PARSER] Dropped invalid {}: {}", type.getSimpleName(), element);
            }
        }
        return result;
    }

    private <T> T validOrNull(JsonNode node, Class<T> type) {
        if (node == null || node.isNull()) return null;
        try {
            T value = objectMapper.treeToValue(node, type);
            return validator.validate(value).isEmpty() ? value : null;
        } catch (Exception e) {
            return null;
        }
    }

    private <T> T convert(JsonNode node, TypeReference<T> type, T fallback) {
        if (node == null || node.isNull()) return fallback;
        try {
            T value = objectMapper.convertValue(node, type);
            return value == null ? fallback : value;
        } catch (IllegalArgumentException e) {
            log.warn("🩹 [PARSER] Field conversion failed ({}), using fallback", e.getMessage());
            return fallback;
        }
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  마무리: 판정 재계산 + 기본 cue 보장
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    private BrainResult finish(BrainResult result) {
        List<DiceRoll> rolls = result.diceRolls() == null ? List.of()
            : result.diceRolls().stream().map(DiceRoll::normalized).collect(Collectors.toList());

        String narrativeCue = result.narrativeCue();
        if (narrativeCue == null || narrativeCue.isBlank()) {
            narrativeCue = result.narrativeCues().stream()
                .map(NarrativeCue::content)
                .collect(Collectors.joining(" "))
                .trim();
        }
        if (narrativeCue.isBlank()) {
            narrativeCue = FALLBACK_CUE;
        }

        PendingRoll pendingRoll = result.pendingRoll() == null ? null : result.pendingRoll().withDefaultType();

        return new BrainResult(
            result.stateUpdates() == null ? new LinkedHashMap<>() : result.stateUpdates(),
            result.narrativeCues(),
            rolls,
            result.systemMessages() == null ? List.of() : result.systemMessages(),
            narrativeCue,
            result.requiresUserInput(),
            result.pendingChoice(),
            pendingRoll
        );
    }

    private static <T> String describe(Set<ConstraintViolation<T>> violations) {
        return violations.stream()
            .map(v -> v.getPropertyPath() + " " + v.getMessage())
            .collect(Collectors.joining(", "));
    }
}

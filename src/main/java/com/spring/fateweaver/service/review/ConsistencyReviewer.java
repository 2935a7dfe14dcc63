package com.spring.fateweaver.service.review;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spring.fateweaver.config.GameProperties;
import com.spring.fateweaver.config.LlmProperties;
import com.spring.fateweaver.dto.turn.ProviderKeys;
import com.spring.fateweaver.engine.state.DeltaSource;
import com.spring.fateweaver.engine.state.MergeResult;
import com.spring.fateweaver.engine.state.StateMerger;
import com.spring.fateweaver.exception.ReviewerFailureException;
import com.spring.fateweaver.external.llm.LlmCompletion;
import com.spring.fateweaver.external.llm.LlmProviderFactory;
import com.spring.fateweaver.external.llm.LlmRequest;
import com.spring.fateweaver.external.llm.ModelRouter;
import com.spring.fateweaver.external.llm.ResolvedModel;
import com.spring.fateweaver.service.parser.JsonObjectExtractor;
import com.spring.fateweaver.service.prompt.ReviewerPromptAssembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.spring.fateweaver.engine.state.StateDocuments.asMap;

/**
 * 상태 일관성 검토 (best-effort)
 *
 * 나레이션이 암시하지만 Brain 델타에 빠진 변화를 찾아 State Merger 로 반영한다.
 * - enabled=false 또는 turnNumber % frequency != 0 이면 건너뜀
 * - 어떤 실패도 턴을 실패시키지 않는다 (empty 반환)
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConsistencyReviewer {

    static final double TEMPERATURE = 0.3;
    static final int MAX_TOKENS = 1000;

    private static final List<String> RESOURCE_POOLS = List.of("hp", "mana", "stamina", "nanites");
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ReviewerPromptAssembler promptAssembler;
    private final ModelRouter modelRouter;
    private final LlmProviderFactory providerFactory;
    private final JsonObjectExtractor extractor;
    private final StateMerger stateMerger;
    private final ObjectMapper objectMapper;
    private final GameProperties gameProperties;
    private final LlmProperties llmProperties;

    public Optional<ReviewOutcome> review(String narrative, Map<String, Object> state, int turnNumber, ProviderKeys keys) {
        GameProperties.Reviewer settings = gameProperties.reviewer();
        if (settings == null || !settings.enabled()) {
            log.debug("🔍 [REVIEWER] Skipped: disabled");
            return Optional.empty();
        }
        int frequency = Math.max(1, settings.frequency());
        if (turnNumber % frequency != 0) {
            log.debug("🔍 [REVIEWER] Skipped: runs every {} turn(s), turn={}", frequency, turnNumber);
            return Optional.empty();
        }

        long start = System.currentTimeMillis();
        try {
            ReviewOutcome outcome = runReview(narrative, state, keys);
            log.info("🔍 [REVIEWER] DONE: {}ms | corrections={} | reasoning={}",
                System.currentTimeMillis() - start, outcome.corrections().keySet(), outcome.reasoning());
            return Optional.of(outcome);
        } catch (RuntimeException e) {
            ReviewerFailureException failure = e instanceof ReviewerFailureException rf
                ? rf : new ReviewerFailureException("State review failed: " + e.getMessage(), e);
            log.warn("🔍 [REVIEWER] Ignored failure after {}ms: {}", System.currentTimeMillis() - start, failure.getMessage());
            return Optional.empty();
        }
    }

    private ReviewOutcome runReview(String narrative, Map<String, Object> state, ProviderKeys keys) {
        ResolvedModel model = modelRouter.resolve(llmProperties.reviewerModel(), keys, "reviewer");

        LlmCompletion completion = providerFactory.create(model).complete(new LlmRequest(
            promptAssembler.assembleSystemPrompt(state, narrative),
            List.of(),
            promptAssembler.assembleUserMessage(narrative),
            TEMPERATURE,
            MAX_TOKENS,
            true
        ));

        ObjectNode node = extractor.extract(completion.text()).value()
            .orElseThrow(() -> new ReviewerFailureException("Reviewer response is not a JSON object", null));

        JsonNode correctionsNode = node.get("corrections");
        Map<String, Object> raw = correctionsNode == null || !correctionsNode.isObject()
            ? Map.of() : objectMapper.convertValue(correctionsNode, MAP_TYPE);
        String reasoning = node.path("reasoning").asText(null);

        Map<String, Object> delta = normalize(raw, state);
        MergeResult merged = stateMerger.merge(state, delta, DeltaSource.MODEL);
        return new ReviewOutcome(merged.state(), delta, merged.warnings(), reasoning, completion.usage(), model);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  보정 → 델타 계약 정규화
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    /**
     * - partyMembers {joined, left} → {added, removed}
     * - powers → abilities (추가 전용)
     * - 자원 풀(hp, mana …)과 fatigue 는 character 하위로
     * - inventory/gold/experience 는 기존 상태에 있는 위치(character 또는 최상위)를 따른다
     */
    Map<String, Object> normalize(Map<String, Object> corrections, Map<String, Object> state) {
        Map<String, Object> delta = new LinkedHashMap<>();
        Map<String, Object> characterDelta = new LinkedHashMap<>();
        Map<String, Object> character = asMap(state.get("character"));

        corrections.forEach((key, value) -> {
            if (value == null) return;
            switch (key) {
                case "partyMembers" -> {
                    Map<String, Object> party = asMap(value);
                    if (party == null) {
                        delta.put(key, value);
                        return;
                    }
                    Map<String, Object> op = new LinkedHashMap<>();
                    op.put("added", firstNonNull(party.get("added"), party.get("joined"), List.of()));
                    op.put("removed", firstNonNull(party.get("removed"), party.get("left"), List.of()));
                    delta.put("partyMembers", op);
                }
                case "powers" -> characterDelta.put("abilities", value);
                case "fatigue" -> characterDelta.put("fatigue", value);
                case "questProgress" -> log.debug("🔍 [REVIEWER] questProgress ignored (engine-managed quest log)");
                default -> {
                    if (RESOURCE_POOLS.contains(key) || (character != null && character.containsKey(key))) {
                        characterDelta.put(key, value);
                    } else {
                        delta.put(key, value);
                    }
                }
            }
        });

        if (!characterDelta.isEmpty()) {
            delta.put("character", characterDelta);
        }
        return delta;
    }

    private static Object firstNonNull(Object a, Object b, Object fallback) {
        if (a != null) return a;
        if (b != null) return b;
        return fallback;
    }
}

package com.spring.fateweaver.service.voice;

import com.spring.fateweaver.config.GameProperties;
import com.spring.fateweaver.dto.turn.ChatMessage;
import com.spring.fateweaver.external.llm.LlmCompletion;
import com.spring.fateweaver.external.llm.LlmProvider;
import com.spring.fateweaver.external.llm.LlmProviderFactory;
import com.spring.fateweaver.external.llm.LlmRequest;
import com.spring.fateweaver.external.llm.TokenUsage;
import com.spring.fateweaver.service.prompt.NarratorPromptAssembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Voice (나레이터)
 *
 * Brain 의 cue + 주사위 결과 + 상태 변화 → 플레이어에게 보여줄 산문
 * 실패해도 턴을 중단하지 않는다: Brain 요약 → 고정 문구 순으로 대체
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NarratorService {

    public static final String LAST_RESORT_TEXT = "The narrator seems momentarily distracted...";

    static final double TEMPERATURE = 0.8;

    private final NarratorPromptAssembler promptAssembler;
    private final LlmProviderFactory providerFactory;
    private final GameProperties gameProperties;

    public Narration narrate(NarrationRequest req) {
        GameProperties.Narrator settings = gameProperties.narrator();
        String modelId = req.model().modelId();

        long start = System.currentTimeMillis();
        try {
            LlmProvider provider = providerFactory.create(req.model());
            LlmRequest request = new LlmRequest(
                promptAssembler.assembleSystemPrompt(req.world(), req.knowledge()),
                recent(req.history(), gameProperties.history().voiceMessages()),
                promptAssembler.assembleCueMessage(req.cues(), req.diceRolls(), req.stateChanges()),
                TEMPERATURE,
                settings.enforceMaxOutputTokens() ? settings.maxOutputTokens() : null,
                false
            );

            LlmCompletion completion = provider.complete(request);
            log.info("🎙️ [VOICE] DONE: {}ms | model={} | chars={}",
                System.currentTimeMillis() - start, modelId, completion.text().length());
            return new Narration(completion.text().trim(), completion.usage(), modelId, false);

        } catch (RuntimeException e) {
            log.warn("🎙️ [VOICE] Narration failed after {}ms, using brain cue: {}",
                System.currentTimeMillis() - start, e.getMessage());
            String fallback = req.fallbackCue() == null || req.fallbackCue().isBlank()
                ? LAST_RESORT_TEXT : req.fallbackCue();
            return new Narration(fallback, TokenUsage.ZERO, modelId, true);
        }
    }

    private static List<ChatMessage> recent(List<ChatMessage> history, int limit) {
        if (history == null || history.isEmpty() || limit <= 0) return List.of();
        return history.subList(Math.max(0, history.size() - limit), history.size());
    }
}

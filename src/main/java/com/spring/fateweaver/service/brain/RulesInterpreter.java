package com.spring.fateweaver.service.brain;

import com.spring.fateweaver.config.GameProperties;
import com.spring.fateweaver.domain.enums.ProviderType;
import com.spring.fateweaver.dto.brain.BrainResult;
import com.spring.fateweaver.dto.turn.ChatMessage;
import com.spring.fateweaver.external.llm.LlmCompletion;
import com.spring.fateweaver.external.llm.LlmProvider;
import com.spring.fateweaver.external.llm.LlmProviderFactory;
import com.spring.fateweaver.external.llm.LlmRequest;
import com.spring.fateweaver.external.llm.ResolvedModel;
import com.spring.fateweaver.service.parser.BrainResponseParser;
import com.spring.fateweaver.service.prompt.BrainPrompt;
import com.spring.fateweaver.service.prompt.BrainPromptAssembler;
import com.spring.fateweaver.service.prompt.BrainPromptContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Brain (규칙 해석기)
 *
 * 프롬프트 조립 → 프로바이더 1회 호출 → 응답 파싱
 * - 빈 응답/호출 실패: ProviderFailureException
 * - 파싱 불가: InvalidResponseException
 * 두 경우 모두 상태 변경이나 과금 전에 턴이 중단된다.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RulesInterpreter {

    static final double TEMPERATURE = 0.5;
    static final int OPENAI_MAX_TOKENS = 2000;

    private final BrainPromptAssembler promptAssembler;
    private final BrainResponseParser responseParser;
    private final LlmProviderFactory providerFactory;
    private final GameProperties gameProperties;

    public BrainTurn interpret(BrainPromptContext context, List<ChatMessage> history, ResolvedModel model) {
        BrainPrompt prompt = promptAssembler.assemble(context);
        LlmProvider provider = providerFactory.create(model);

        LlmRequest request = new LlmRequest(
            prompt.systemPrompt(),
            recent(history, gameProperties.history().brainMessages()),
            prompt.userMessage(),
            TEMPERATURE,
            model.provider() == ProviderType.OPENAI ? OPENAI_MAX_TOKENS : null,
            true
        );

        long start = System.currentTimeMillis();
        log.info("🧠 [BRAIN] Call START | model={} | promptChars={}", model, prompt.systemPrompt().length());
        LlmCompletion completion = provider.complete(request);
        log.info("🧠 [BRAIN] Call DONE: {}ms | tokens={}", System.currentTimeMillis() - start,
            completion.usage().totalTokens());

        BrainResult result = responseParser.parse(completion.text());
        log.debug("🧠 [BRAIN] cues={} rolls={} pendingRoll={} requiresUserInput={}",
            result.narrativeCues().size(), result.diceRolls().size(), result.pendingRoll() != null,
            result.requiresUserInput());

        return new BrainTurn(result, completion.usage(), model.modelId());
    }

    static List<ChatMessage> recent(List<ChatMessage> history, int limit) {
        if (history == null || history.isEmpty() || limit <= 0) return List.of();
        return history.subList(Math.max(0, history.size() - limit), history.size());
    }
}

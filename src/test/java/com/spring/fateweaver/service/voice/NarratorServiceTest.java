package com.spring.fateweaver.service.voice;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spring.fateweaver.config.GameProperties;
import com.spring.fateweaver.domain.enums.ProviderType;
import com.spring.fateweaver.domain.enums.WorldEngine;
import com.spring.fateweaver.dto.brain.NarrativeCue;
import com.spring.fateweaver.dto.turn.ChatMessage;
import com.spring.fateweaver.exception.ProviderFailureException;
import com.spring.fateweaver.external.llm.LlmCompletion;
import com.spring.fateweaver.external.llm.LlmProvider;
import com.spring.fateweaver.external.llm.LlmProviderFactory;
import com.spring.fateweaver.external.llm.LlmRequest;
import com.spring.fateweaver.external.llm.ResolvedModel;
import com.spring.fateweaver.external.llm.TokenUsage;
import com.spring.fateweaver.service.prompt.NarratorPromptAssembler;
import com.spring.fateweaver.service.prompt.WorldProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NarratorServiceTest {

    private static final ResolvedModel MODEL =
        new ResolvedModel("gpt-4o-mini", "gpt-4o-mini", ProviderType.OPENAI, "key", false, false);

    private LlmProvider provider;
    private NarratorService narrator;

    @BeforeEach
    void setUp() {
        GameProperties game = new GameProperties(
            new GameProperties.Economy(10, Map.of(), List.of()),
            new GameProperties.Narrator(150, 250, true, 600, false),
            new GameProperties.Reviewer(false, 1),
            new GameProperties.History(10, 4),
            new GameProperties.Knowledge(2, 3, 300),
            new GameProperties.TurnLock(120),
            new GameProperties.ChargeRecovery(60000, 300)
        );
        provider = mock(LlmProvider.class);
        LlmProviderFactory factory = mock(LlmProviderFactory.class);
        when(factory.create(any())).thenReturn(provider);

        narrator = new NarratorService(new NarratorPromptAssembler(game, new ObjectMapper()), factory, game);
    }

    private static NarrationRequest request(List<ChatMessage> history, String fallbackCue) {
        return new NarrationRequest(
            new WorldProfile("classic-fantasy", "Classic Fantasy", WorldEngine.CLASSIC, "rules", "style"),
            List.of(),
            List.of(NarrativeCue.description("The door creaks open.")),
            List.of(),
            Map.of(),
            history,
            MODEL,
            fallbackCue);
    }

    @Test
    void narration_is_trimmed_and_history_is_limited() {
        when(provider.complete(any())).thenReturn(
            new LlmCompletion("  The door groans on rusted hinges.  ", new TokenUsage(50, 40), "gpt-4o-mini"));
        List<ChatMessage> history = IntStream.range(0, 10)
            .mapToObj(i -> i % 2 == 0 ? ChatMessage.user("u" + i) : ChatMessage.assistant("a" + i))
            .toList();

        Narration narration = narrator.narrate(request(history, "The door opens."));

        assertThat(narration.text()).isEqualTo("The door groans on rusted hinges.");
        assertThat(narration.fallback()).isFalse();
        assertThat(narration.usage()).isEqualTo(new TokenUsage(50, 40));

        ArgumentCaptor<LlmRequest> sent = ArgumentCaptor.forClass(LlmRequest.class);
        verify(provider).complete(sent.capture());
        assertThat(sent.getValue().history()).hasSize(4).last().isEqualTo(ChatMessage.assistant("a9"));
        assertThat(sent.getValue().maxTokens()).isEqualTo(600);
        assertThat(sent.getValue().jsonMode()).isFalse();
    }

    @Test
    void provider_failure_falls_back_to_the_brain_cue() {
        when(provider.complete(any())).thenThrow(new ProviderFailureException("upstream 503"));

        Narration narration = narrator.narrate(request(List.of(), "The door opens."));

        assertThat(narration.fallback()).isTrue();
        assertThat(narration.text()).isEqualTo("The door opens.");
        assertThat(narration.usage()).isEqualTo(TokenUsage.ZERO);
    }

    @Test
    void blank_brain_cue_uses_the_last_resort_text() {
        when(provider.complete(any())).thenThrow(new ProviderFailureException("timeout"));

        Narration narration = narrator.narrate(request(null, " "));

        assertThat(narration.text()).isEqualTo(NarratorService.LAST_RESORT_TEXT);
    }
}

package com.spring.fateweaver.service.review;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spring.fateweaver.config.GameProperties;
import com.spring.fateweaver.config.LlmProperties;
import com.spring.fateweaver.dto.turn.ProviderKeys;
import com.spring.fateweaver.engine.state.StateMerger;
import com.spring.fateweaver.exception.ProviderFailureException;
import com.spring.fateweaver.external.llm.LlmCompletion;
import com.spring.fateweaver.external.llm.LlmProvider;
import com.spring.fateweaver.external.llm.LlmProviderFactory;
import com.spring.fateweaver.external.llm.ModelRouter;
import com.spring.fateweaver.external.llm.TokenUsage;
import com.spring.fateweaver.service.parser.JsonObjectExtractor;
import com.spring.fateweaver.service.prompt.ReviewerPromptAssembler;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConsistencyReviewerTest {

    private static final Map<String, Object> STATE = Map.of(
        "character", Map.of("name", "Aria", "hp", 20, "inventory", List.of("Rope")),
        "gold", 10,
        "partyMembers", List.of("Brom"));

    private final LlmProvider provider = mock(LlmProvider.class);
    private final LlmProviderFactory factory = mock(LlmProviderFactory.class);

    private ConsistencyReviewer reviewer(boolean enabled, int frequency) {
        ObjectMapper objectMapper = new ObjectMapper();
        GameProperties game = new GameProperties(
            new GameProperties.Economy(10, Map.of(), List.of()),
            new GameProperties.Narrator(150, 250, true, 600, false),
            new GameProperties.Reviewer(enabled, frequency),
            new GameProperties.History(10, 4),
            new GameProperties.Knowledge(2, 3, 300),
            new GameProperties.TurnLock(120),
            new GameProperties.ChargeRecovery(60000, 300)
        );
        LlmProperties llm = new LlmProperties(
            new LlmProperties.ProviderSettings("server-key", "http://localhost/v1", null), null, null,
            "gpt-4o-mini", "gpt-4o-mini", "gpt-4o-mini", "gpt-4o-mini", Map.of());
        when(factory.create(any())).thenReturn(provider);

        return new ConsistencyReviewer(new ReviewerPromptAssembler(objectMapper), new ModelRouter(llm), factory,
            new JsonObjectExtractor(objectMapper), new StateMerger(), objectMapper, game, llm);
    }

    @Test
    void corrections_are_normalized_into_the_delta_contract() {
        Map<String, Object> delta = reviewer(true, 1).normalize(Map.of(
            "partyMembers", Map.of("joined", List.of("Lyra"), "left", List.of("Brom")),
            "powers", List.of("Stone Skin"),
            "hp", 12,
            "inventory", Map.of("added", List.of("Lantern")),
            "gold", 15,
            "questProgress", Map.of("q1", "done")), STATE);

        assertThat(delta).containsEntry("partyMembers",
            Map.of("added", List.of("Lyra"), "removed", List.of("Brom")));
        assertThat(delta).containsEntry("gold", 15).doesNotContainKey("questProgress");
        assertThat(delta.get("character")).isEqualTo(Map.of(
            "abilities", List.of("Stone Skin"),
            "hp", 12,
            "inventory", Map.of("added", List.of("Lantern"))));
    }

    @Test
    void review_merges_corrections_through_the_protected_merger() {
        ConsistencyReviewer reviewer = reviewer(true, 1);
        when(provider.complete(any())).thenReturn(new LlmCompletion(
            "{\"corrections\": {\"partyMembers\": {\"joined\": [\"Lyra\"]}, \"hp\": 12}, \"reasoning\": \"Lyra joined.\"}",
            new TokenUsage(300, 40), "gpt-4o-mini"));

        Optional<ReviewOutcome> outcome = reviewer.review("Lyra joins you. A blade grazes your arm.", STATE, 3, ProviderKeys.none());

        assertThat(outcome).hasValueSatisfying(o -> {
            assertThat(o.state().get("partyMembers")).isEqualTo(List.of("Brom", "Lyra"));
            assertThat(o.state().get("character")).isEqualTo(
                Map.of("name", "Aria", "hp", 12, "inventory", List.of("Rope")));
            assertThat(o.reasoning()).isEqualTo("Lyra joined.");
            assertThat(o.usage()).isEqualTo(new TokenUsage(300, 40));
        });
    }

    @Test
    void reviewer_cannot_remove_learned_abilities() {
        Map<String, Object> state = Map.of(
            "character", Map.of("name", "Aria", "abilities", List.of("Fireball", "Shield")));
        ConsistencyReviewer reviewer = reviewer(true, 1);
        when(provider.complete(any())).thenReturn(new LlmCompletion(
            "{\"corrections\": {\"abilities\": {\"removed\": [\"Fireball\"]}, \"powers\": {\"removed\": [\"Shield\"]}},"
                + " \"reasoning\": \"The fireball fizzled.\"}",
            new TokenUsage(200, 30), "gpt-4o-mini"));

        Optional<ReviewOutcome> outcome = reviewer.review("Your fireball fizzles.", state, 1, ProviderKeys.none());

        assertThat(outcome).hasValueSatisfying(o -> {
            @SuppressWarnings("unchecked")
            Map<String, Object> character = (Map<String, Object>) o.state().get("character");
            assertThat(character.get("abilities")).isEqualTo(List.of("Fireball", "Shield"));
            assertThat(o.warnings()).anyMatch(w -> w.contains("add-only"));
        });
    }

    @Test
    void turns_off_the_frequency_are_skipped() {
        Optional<ReviewOutcome> outcome = reviewer(true, 2).review("text", STATE, 3, ProviderKeys.none());

        assertThat(outcome).isEmpty();
        verify(provider, never()).complete(any());
    }

    @Test
    void disabled_reviewer_never_calls_a_model() {
        assertThat(reviewer(false, 1).review("text", STATE, 2, ProviderKeys.none())).isEmpty();
        verify(factory, never()).create(any());
    }

    @Test
    void failures_are_swallowed_into_an_empty_outcome() {
        ConsistencyReviewer reviewer = reviewer(true, 1);
        when(provider.complete(any())).thenThrow(new ProviderFailureException("rate limited"));

        assertThat(reviewer.review("text", STATE, 1, ProviderKeys.none())).isEmpty();
    }

    @Test
    void non_json_reply_is_treated_as_a_failure() {
        ConsistencyReviewer reviewer = reviewer(true, 1);
        when(provider.complete(any())).thenReturn(new LlmCompletion("Everything looks fine.", TokenUsage.ZERO, "gpt-4o-mini"));

        assertThat(reviewer.review("text", STATE, 1, ProviderKeys.none())).isEmpty();
    }
}

package com.spring.fateweaver.service.economy;

import com.spring.fateweaver.config.GameProperties;
import com.spring.fateweaver.domain.enums.ProviderType;
import com.spring.fateweaver.domain.enums.UserTier;
import com.spring.fateweaver.external.llm.ResolvedModel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TurnCostResolverTest {

    private final TurnCostResolver resolver = new TurnCostResolver(new GameProperties(
        new GameProperties.Economy(1, Map.of("claude-opus", 5, "gpt-4o", 3), List.of("legendary")),
        null, null, null, null, null, null));

    private static ResolvedModel model(String requestedId, String modelId) {
        return new ResolvedModel(requestedId, modelId, ProviderType.fromModelId(modelId), "key", false, false);
    }

    @Test
    void ui_id_cost_wins_over_model_id_cost() {
        assertThat(resolver.cost(model("claude-opus", "gpt-4o"), UserTier.HERO)).isEqualTo(5);
    }

    @Test
    void model_id_cost_is_used_when_the_ui_id_has_none() {
        assertThat(resolver.cost(model("my-favourite", "gpt-4o"), UserTier.HERO)).isEqualTo(3);
    }

    @Test
    void unknown_models_cost_the_default() {
        assertThat(resolver.cost(model("gemini-pro", "gemini-1.5-pro"), UserTier.SCOUT)).isEqualTo(1);
    }

    @Test
    void free_tier_pays_nothing() {
        assertThat(resolver.cost(model("claude-opus", "claude-3-opus"), UserTier.LEGENDARY)).isZero();
    }
}

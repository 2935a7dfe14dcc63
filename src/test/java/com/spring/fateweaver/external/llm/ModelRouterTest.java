package com.spring.fateweaver.external.llm;

import com.spring.fateweaver.config.LlmProperties;
import com.spring.fateweaver.config.LlmProperties.ProviderSettings;
import com.spring.fateweaver.domain.enums.ProviderType;
import com.spring.fateweaver.dto.turn.ProviderKeys;
import com.spring.fateweaver.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelRouterTest {

    private static final Map<String, String> ALIASES = Map.of(
        "claude-sonnet-3.5", "claude-3-5-sonnet-20241022",
        "gpt-4o-mini", "gpt-4o-mini");

    private static LlmProperties props(String openAiKey, String anthropicKey) {
        return new LlmProperties(
            new ProviderSettings(openAiKey, "https://api.openai.com/v1", null),
            new ProviderSettings(anthropicKey, "https://api.anthropic.com/v1", "2023-06-01"),
            new ProviderSettings(null, "https://generativelanguage.googleapis.com/v1beta", null),
            "gpt-4o-mini", "claude-sonnet-3.5", "gpt-4o-mini", "gpt-4o-mini", ALIASES);
    }

    @Test
    void user_key_takes_precedence_over_the_server_key() {
        ModelRouter router = new ModelRouter(props("server-openai", "server-anthropic"));

        ResolvedModel model = router.resolve("claude-sonnet-3.5", new ProviderKeys(null, "user-anthropic", null), "voice");

        assertThat(model.modelId()).isEqualTo("claude-3-5-sonnet-20241022");
        assertThat(model.provider()).isEqualTo(ProviderType.ANTHROPIC);
        assertThat(model.apiKey()).isEqualTo("user-anthropic");
        assertThat(model.byok()).isTrue();
        assertThat(model.fallback()).isFalse();
    }

    @Test
    void server_key_is_used_without_a_user_key() {
        ModelRouter router = new ModelRouter(props("server-openai", "server-anthropic"));

        ResolvedModel model = router.resolve("claude-sonnet-3.5", ProviderKeys.none(), "voice");

        assertThat(model.apiKey()).isEqualTo("server-anthropic");
        assertThat(model.byok()).isFalse();
    }

    @Test
    void missing_provider_credentials_fall_back_to_openai() {
        ModelRouter router = new ModelRouter(props("server-openai", null));

        ResolvedModel model = router.resolve("claude-sonnet-3.5", ProviderKeys.none(), "voice");

        assertThat(model.fallback()).isTrue();
        assertThat(model.provider()).isEqualTo(ProviderType.OPENAI);
        assertThat(model.modelId()).isEqualTo("gpt-4o-mini");
        assertThat(model.requestedId()).isEqualTo("claude-sonnet-3.5");
    }

    @Test
    void unknown_ids_pass_through_and_blank_ids_use_the_fallback_model() {
        ModelRouter router = new ModelRouter(props("server-openai", null));

        assertThat(router.resolve("gpt-4.1", null, "brain").modelId()).isEqualTo("gpt-4.1");
        assertThat(router.resolve(" ", null, "brain").modelId()).isEqualTo("gpt-4o-mini");
    }

    @Test
    void no_credentials_at_all_is_a_configuration_error() {
        ModelRouter router = new ModelRouter(props(null, null));

        assertThatThrownBy(() -> router.resolve("claude-sonnet-3.5", ProviderKeys.none(), "brain"))
            .isInstanceOf(ConfigurationException.class);
    }
}

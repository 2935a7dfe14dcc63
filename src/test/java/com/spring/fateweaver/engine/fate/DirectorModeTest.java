package com.spring.fateweaver.engine.fate;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DirectorModeTest {

    private final DirectorMode directorMode = new DirectorMode();

    @Test
    void triggers_once_when_health_drops_below_a_quarter() {
        Map<String, Object> character = Map.of("hp", Map.of("current", 4, "max", 20));

        var activation = directorMode.check(character, FateEngineState.initial());

        assertThat(activation).isPresent();
        assertThat(activation.get().nextState().directorModeCooldown()).isTrue();
        assertThat(activation.get().systemMessage()).contains("critical HP");
        assertThat(directorMode.check(character, activation.get().nextState())).isEmpty();
    }

    @Test
    void triggers_on_low_resource_pool() {
        Map<String, Object> character = Map.of(
            "hp", Map.of("current", 20, "max", 20),
            "mana", Map.of("current", 1, "max", 10));

        assertThat(directorMode.check(character, FateEngineState.initial()))
            .hasValueSatisfying(a -> assertThat(a.systemMessage()).contains("low mana"));
    }

    @Test
    void healthy_character_does_not_trigger() {
        Map<String, Object> character = Map.of("hp", Map.of("current", 10, "max", 20));

        assertThat(directorMode.check(character, FateEngineState.initial())).isEmpty();
    }
}

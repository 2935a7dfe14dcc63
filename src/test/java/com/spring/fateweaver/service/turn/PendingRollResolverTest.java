package com.spring.fateweaver.service.turn;

import com.spring.fateweaver.domain.enums.WorldEngine;
import com.spring.fateweaver.dto.turn.DiceRoll;
import com.spring.fateweaver.dto.turn.PendingRoll;
import com.spring.fateweaver.engine.fate.FateEngineState;
import com.spring.fateweaver.engine.fate.FateResolver;
import com.spring.fateweaver.engine.fate.SequenceDiceRoller;
import com.spring.fateweaver.service.turn.PendingRollResolver.RolledDice;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PendingRollResolverTest {

    private static final Map<String, Object> STATE = Map.of(
        "character", Map.of("level", 1, "stats", Map.of("strength", 16)),
        "fateEngine", new FateEngineState(0, 3, false).toDocument());

    private final PendingRollResolver resolver =
        new PendingRollResolver(new FateResolver(new SequenceDiceRoller(11)), new SequenceDiceRoller(3, 5));

    private static PendingRoll roll(String type, Integer modifier, String stat, Boolean proficient, Integer itemBonus) {
        return new PendingRoll(type, "Force the door", modifier, stat, 15, proficient, itemBonus, null, null);
    }

    @Test
    void stat_rolls_use_the_character_sheet_and_ignore_the_model_modifier() {
        RolledDice rolled = resolver.resolve(roll("d20", 99, "STR", true, 1), STATE, WorldEngine.CLASSIC, 12);

        DiceRoll dice = rolled.roll();
        assertThat(dice.rawRolls()).containsExactly(12);
        assertThat(dice.math().statModifier()).isEqualTo(3);
        assertThat(dice.math().proficiency()).isEqualTo(2);
        assertThat(dice.math().itemBonus()).isEqualTo(1);
        assertThat(dice.math().situationalModifier()).isZero();
        assertThat(dice.modifier()).isEqualTo(6);
        assertThat(dice.total()).isEqualTo(dice.result() + dice.modifier());
        assertThat(dice.label()).isEqualTo("Force the door");
    }

    @Test
    void rolls_without_a_stat_treat_the_modifier_as_situational() {
        RolledDice rolled = resolver.resolve(roll(null, 4, null, true, 3), STATE, WorldEngine.CLASSIC, null);

        DiceRoll dice = rolled.roll();
        assertThat(dice.type()).isEqualTo("d20");
        assertThat(dice.rawRolls()).containsExactly(11);
        assertThat(dice.math().statModifier()).isZero();
        assertThat(dice.math().proficiency()).isZero();
        assertThat(dice.math().itemBonus()).isZero();
        assertThat(dice.math().situationalModifier()).isEqualTo(4);
    }

    @Test
    void plain_notation_is_summed_and_leaves_fate_state_alone() {
        RolledDice rolled = resolver.resolve(roll("2d6+1", null, null, null, null), STATE, WorldEngine.CLASSIC, null);

        assertThat(rolled.roll().type()).isEqualTo("2d6+1");
        assertThat(rolled.roll().result()).isEqualTo(8);
        assertThat(rolled.roll().modifier()).isEqualTo(1);
        assertThat(rolled.roll().total()).isEqualTo(9);
        assertThat(rolled.roll().success()).isFalse();
        assertThat(rolled.nextState()).isEqualTo(new FateEngineState(0, 3, false));
    }

    @Test
    void unreadable_notation_rolls_a_d20() {
        RolledDice rolled = resolver.resolve(roll("a handful of bones", 0, null, null, null), STATE, WorldEngine.CLASSIC, null);

        assertThat(rolled.roll().type()).isEqualTo("d20");
        assertThat(rolled.roll().rawRolls()).containsExactly(11);
    }

    @Test
    void missing_or_corrupt_fate_state_starts_fresh() {
        assertThat(PendingRollResolver.fateStateOf(Map.of())).isEqualTo(FateEngineState.initial());
        assertThat(PendingRollResolver.fateStateOf(Map.of("fateEngine", "broken"))).isEqualTo(FateEngineState.initial());
        assertThat(PendingRollResolver.fateStateOf(Map.of("fateEngine", Map.of("momentum_counter", 42))))
            .isEqualTo(FateEngineState.initial());
    }
}

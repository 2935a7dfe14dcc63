package com.spring.fateweaver.engine.fate;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FateResolverTest {

    private static FateRollRequest.FateRollRequestBuilder plain() {
        return FateRollRequest.builder()
            .rollType("attack")
            .advantageSources(List.of())
            .disadvantageSources(List.of())
            .statValue(10)
            .proficiencyBonus(2);
    }

    private static FateResolution roll(FateEngineState state, FateRollRequest request, Integer... dice) {
        return new FateResolver(new SequenceDiceRoller(dice)).resolve(request, state);
    }

    @Test
    void natural_twenty_is_always_critical() {
        FateResolution r = roll(FateEngineState.initial(), plain().build(), 20);

        assertThat(r.roll().flags().critical()).isTrue();
        assertThat(r.roll().flags().pityCrit()).isFalse();
        assertThat(r.nextState().turnsSinceCrit()).isZero();
    }

    @Test
    void natural_nineteen_is_a_pity_crit_only_after_more_than_forty_rolls() {
        FateResolution atForty = roll(new FateEngineState(0, 40, false), plain().build(), 19);
        FateResolution afterForty = roll(new FateEngineState(0, 41, false), plain().build(), 19);

        assertThat(atForty.roll().flags().critical()).isFalse();
        assertThat(atForty.nextState().turnsSinceCrit()).isEqualTo(41);
        assertThat(afterForty.roll().flags().critical()).isTrue();
        assertThat(afterForty.roll().flags().pityCrit()).isTrue();
        assertThat(afterForty.nextState().turnsSinceCrit()).isZero();
    }

    @Test
    void natural_one_is_rerolled_once_when_momentum_exceeds_four() {
        FateResolution r = roll(new FateEngineState(5, 0, false), plain().build(), 1, 14);

        assertThat(r.roll().rawRolls()).containsExactly(1, 14);
        assertThat(r.roll().flags().fumbleRerolled()).isTrue();
        assertThat(r.roll().flags().fumble()).isFalse();
        assertThat(r.roll().result()).isEqualTo(Math.min(20, 14 + 5));
        // 모멘텀 갱신은 자연값(1) 기준
        assertThat(r.nextState().momentum()).isEqualTo(7);
    }

    @Test
    void reroll_that_lands_on_one_is_still_a_fumble() {
        FateResolution r = roll(new FateEngineState(6, 0, false), plain().build(), 1, 1);

        assertThat(r.roll().flags().fumbleRerolled()).isTrue();
        assertThat(r.roll().flags().fumble()).isTrue();
        assertThat(r.roll().rawRolls()).hasSize(2);
    }

    @Test
    void natural_one_at_momentum_four_is_an_unconditional_fumble() {
        FateResolution r = roll(new FateEngineState(4, 0, false), plain().build(), 1, 20);

        assertThat(r.roll().flags().fumble()).isTrue();
        assertThat(r.roll().flags().fumbleRerolled()).isFalse();
        assertThat(r.roll().rawRolls()).containsExactly(1);
    }

    @Test
    void momentum_grows_on_low_rolls_up_to_ten_and_resets_above_twelve() {
        assertThat(roll(new FateEngineState(9, 0, false), plain().build(), 5).nextState().momentum()).isEqualTo(10);
        assertThat(roll(new FateEngineState(10, 0, false), plain().build(), 3).nextState().momentum()).isEqualTo(10);
        assertThat(roll(new FateEngineState(6, 0, false), plain().build(), 10).nextState().momentum()).isEqualTo(6);
        assertThat(roll(new FateEngineState(6, 0, false), plain().build(), 13).nextState().momentum()).isZero();
    }

    @Test
    void momentum_never_manufactures_a_critical() {
        FateResolution r = roll(new FateEngineState(10, 0, false), plain().build(), 12);

        assertThat(r.roll().result()).isEqualTo(20);
        assertThat(r.roll().flags().critical()).isFalse();
        assertThat(r.roll().math().momentumBonus()).isEqualTo(8);
    }

    @Test
    void advantage_and_disadvantage_cancel_to_a_single_die() {
        FateRollRequest request = plain()
            .advantageSources(List.of("flanking"))
            .disadvantageSources(List.of("blinded"))
            .build();

        FateResolution r = roll(FateEngineState.initial(), request, 7, 18);

        assertThat(r.roll().rawRolls()).containsExactly(7);
        assertThat(r.roll().flags().advantage()).isFalse();
        assertThat(r.roll().flags().disadvantage()).isFalse();
    }

    @Test
    void advantage_keeps_the_higher_die_and_disadvantage_the_lower() {
        FateResolution adv = roll(FateEngineState.initial(), plain().advantageSources(List.of("hidden")).build(), 5, 17);
        FateResolution dis = roll(FateEngineState.initial(), plain().disadvantageSources(List.of("prone")).build(), 5, 17);

        assertThat(adv.roll().selectedBase()).isEqualTo(17);
        assertThat(dis.roll().selectedBase()).isEqualTo(5);
    }

    @Test
    void modifier_stack_adds_stat_proficiency_item_and_situational() {
        FateRollRequest request = plain()
            .statValue(16)
            .proficient(true)
            .proficiencyBonus(3)
            .itemBonus(1)
            .situationalModifier(-2)
            .difficulty(15)
            .build();

        FateResolution r = roll(FateEngineState.initial(), request, 10);

        assertThat(r.roll().math().statModifier()).isEqualTo(3);
        assertThat(r.roll().modifier()).isEqualTo(3 + 3 + 1 - 2);
        assertThat(r.roll().total()).isEqualTo(15);
        assertThat(r.roll().outcome().success()).isTrue();
        assertThat(r.roll().outcome().margin()).isZero();
    }

    @Test
    void stat_modifier_rounds_down() {
        assertThat(FateResolver.statModifier(9)).isEqualTo(-1);
        assertThat(FateResolver.statModifier(11)).isZero();
        assertThat(FateResolver.statModifier(3)).isEqualTo(-4);
    }

    @Test
    void supplied_roll_replaces_the_first_die() {
        FateResolution r = roll(FateEngineState.initial(), plain().suppliedNaturalRoll(20).build(), 3);

        assertThat(r.roll().rawRolls()).containsExactly(20);
        assertThat(r.roll().flags().critical()).isTrue();
    }

    @Test
    void supplied_roll_outside_one_to_twenty_is_rejected() {
        assertThatThrownBy(() -> roll(FateEngineState.initial(), plain().suppliedNaturalRoll(21).build(), 3))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> roll(FateEngineState.initial(), plain().suppliedNaturalRoll(0).build(), 3))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

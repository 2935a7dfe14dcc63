package com.spring.fateweaver.engine.fate;

import com.spring.fateweaver.domain.enums.WorldEngine;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CharacterStatsTest {

    @Test
    void abbreviations_map_to_world_specific_stats() {
        Map<String, Object> outworlder = Map.of("stats", Map.of("power", 14, "speed", 12));
        Map<String, Object> classic = Map.of("stats", Map.of("Strength", 17));

        assertThat(CharacterStats.statValue(outworlder, "STR", WorldEngine.OUTWORLDER)).isEqualTo(14);
        assertThat(CharacterStats.statValue(outworlder, "Dexterity", WorldEngine.OUTWORLDER)).isEqualTo(12);
        assertThat(CharacterStats.statValue(classic, "str", WorldEngine.CLASSIC)).isEqualTo(17);
    }

    @Test
    void missing_stat_falls_back_to_ten() {
        assertThat(CharacterStats.statValue(Map.of(), "WIS", WorldEngine.CLASSIC)).isEqualTo(10);
        assertThat(CharacterStats.statValue(null, "WIS", WorldEngine.CLASSIC)).isEqualTo(10);
    }

    @Test
    void proficiency_prefers_explicit_value_then_level() {
        assertThat(CharacterStats.proficiencyBonus(Map.of("proficiencyBonus", 4))).isEqualTo(4);
        assertThat(CharacterStats.proficiencyBonus(Map.of("level", 1))).isEqualTo(2);
        assertThat(CharacterStats.proficiencyBonus(Map.of("level", 5))).isEqualTo(3);
        assertThat(CharacterStats.proficiencyBonus(Map.of("level", 17))).isEqualTo(6);
    }
}

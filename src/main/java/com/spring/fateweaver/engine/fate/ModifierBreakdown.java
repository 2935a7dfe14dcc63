package com.spring.fateweaver.engine.fate;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 보정치 내역. momentumBonus는 다이스 값에 이미 반영되어 있으므로 total에 포함하지 않는다.
 */
public record ModifierBreakdown(
    @JsonProperty("stat_mod") int statModifier,
    @JsonProperty("proficiency") int proficiency,
    @JsonProperty("item_bonus") int itemBonus,
    @JsonProperty("situational_mod") int situationalModifier,
    @JsonProperty("momentum_mod") int momentumBonus
) {
    @JsonProperty("total")
    public int total() {
        return statModifier + proficiency + itemBonus + situationalModifier;
    }
}

package com.spring.fateweaver.engine.fate;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RollOutcome(
    @JsonProperty("target_dc") int targetDc,
    @JsonProperty("difficulty_tier") DifficultyTier difficultyTier,
    @JsonProperty("success") boolean success,
    @JsonProperty("margin") int margin,
    @JsonProperty("narrative_tag") String narrativeTag
) {
    public static RollOutcome evaluate(int total, int dc) {
        boolean success = total >= dc;
        return new RollOutcome(dc, DifficultyTier.of(dc), success, total - dc, success ? "Hit" : "Miss");
    }
}

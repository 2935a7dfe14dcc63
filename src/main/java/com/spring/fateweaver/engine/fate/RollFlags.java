package com.spring.fateweaver.engine.fate;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RollFlags(
    @JsonProperty("advantage") boolean advantage,
    @JsonProperty("disadvantage") boolean disadvantage,
    @JsonProperty("is_crit") boolean critical,
    @JsonProperty("is_fumble") boolean fumble,
    @JsonProperty("streak_breaker_active") boolean streakBreakerActive,
    @JsonProperty("fumble_rerolled") boolean fumbleRerolled,
    @JsonProperty("pity_crit") boolean pityCrit
) {}

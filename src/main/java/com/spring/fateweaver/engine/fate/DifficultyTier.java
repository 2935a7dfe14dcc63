package com.spring.fateweaver.engine.fate;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DifficultyTier {
    TRIVIAL("trivial"),
    VERY_EASY("very_easy"),
    EASY("easy"),
    MODERATE("moderate"),
    HARD("hard"),
    HEROIC("heroic");

    private final String label;

    DifficultyTier(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static DifficultyTier of(int dc) {
        if (dc <= 4) return TRIVIAL;
        if (dc <= 9) return VERY_EASY;
        if (dc <= 14) return EASY;
        if (dc <= 17) return MODERATE;
        if (dc <= 19) return HARD;
        return HEROIC;
    }
}

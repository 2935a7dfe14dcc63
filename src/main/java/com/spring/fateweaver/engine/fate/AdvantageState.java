package com.spring.fateweaver.engine.fate;

import java.util.List;

public enum AdvantageState {
    STRAIGHT,
    ADVANTAGE,
    DISADVANTAGE;

    /** 유리/불리 요인이 모두 있으면 상쇄되어 일반 굴림 */
    public static AdvantageState resolve(List<String> advantageSources, List<String> disadvantageSources) {
        boolean hasAdvantage = advantageSources != null && !advantageSources.isEmpty();
        boolean hasDisadvantage = disadvantageSources != null && !disadvantageSources.isEmpty();

        if (hasAdvantage && hasDisadvantage) return STRAIGHT;
        if (hasAdvantage) return ADVANTAGE;
        if (hasDisadvantage) return DISADVANTAGE;
        return STRAIGHT;
    }

    public int diceCount() {
        return this == STRAIGHT ? 1 : 2;
    }
}

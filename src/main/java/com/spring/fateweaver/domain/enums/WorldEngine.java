package com.spring.fateweaver.domain.enums;

/**
 * 월드 규칙 엔진 종류
 * - CLASSIC: D&D 5e 계열 (STR/DEX/CON/INT/WIS/CHA)
 * - OUTWORLDER: 에센스/랭크 기반 (power/speed/spirit/recovery)
 * - TACTICAL: 전술 RPG (strength/agility/vitality/intelligence/perception)
 */
public enum WorldEngine {
    CLASSIC,
    OUTWORLDER,
    TACTICAL;

    /**
     * 월드 식별자 → 엔진. 레거시 id "shadowMonarch"는 TACTICAL로 취급
     */
    public static WorldEngine fromId(String worldId) {
        if (worldId == null) return CLASSIC;
        return switch (worldId.trim().toLowerCase()) {
            case "outworlder" -> OUTWORLDER;
            case "tactical", "shadowmonarch" -> TACTICAL;
            default -> CLASSIC;
        };
    }
}

package com.spring.fateweaver.engine.fate;

import com.spring.fateweaver.domain.enums.WorldEngine;

import java.util.Locale;
import java.util.Map;

/**
 * 캐릭터 문서에서 판정용 수치를 읽어오는 헬퍼
 * - D&D 약어(STR, DEX…)를 월드별 능력치 이름으로 변환
 * - 능력치를 찾지 못하면 10 (보정 0)
 */
public final class CharacterStats {

    public static final int DEFAULT_STAT = 10;

    private static final Map<String, String> OUTWORLDER_STATS = Map.of(
        "STR", "power",
        "DEX", "speed",
        "CON", "stamina",
        "INT", "power",
        "WIS", "recovery",
        "CHA", "power"
    );

    private static final Map<String, String> TACTICAL_STATS = Map.of(
        "STR", "strength",
        "DEX", "agility",
        "CON", "vitality",
        "INT", "intelligence",
        "WIS", "perception",
        "CHA", "intelligence"
    );

    private static final Map<String, String> CLASSIC_STATS = Map.of(
        "STR", "strength",
        "DEX", "dexterity",
        "CON", "constitution",
        "INT", "intelligence",
        "WIS", "wisdom",
        "CHA", "charisma"
    );

    private CharacterStats() {}

    /**
     * @param character GameState.character 맵 (null 허용)
     * @param stat      "STR", "Strength", "power" 등
     */
    public static int statValue(Map<String, Object> character, String stat, WorldEngine engine) {
        if (character == null || stat == null || stat.isBlank()) return DEFAULT_STAT;
        Object statsRaw = character.get("stats");
        if (!(statsRaw instanceof Map<?, ?> stats)) return DEFAULT_STAT;

        // 1. 이름 그대로 (대소문자 무시)
        Integer direct = lookupIgnoreCase(stats, stat);
        if (direct != null) return direct;

        // 2. 약어 → 월드별 이름
        String abbreviation = stat.trim().length() >= 3
            ? stat.trim().substring(0, 3).toUpperCase(Locale.ROOT)
            : stat.trim().toUpperCase(Locale.ROOT);
        String mapped = switch (engine) {
            case OUTWORLDER -> OUTWORLDER_STATS.get(abbreviation);
            case TACTICAL -> TACTICAL_STATS.get(abbreviation);
            case CLASSIC -> CLASSIC_STATS.get(abbreviation);
        };
        if (mapped != null) {
            Integer value = lookupIgnoreCase(stats, mapped);
            if (value != null) return value;
            value = lookupIgnoreCase(stats, abbreviation);
            if (value != null) return value;
        }
        return DEFAULT_STAT;
    }

    /**
     * 명시적 proficiencyBonus가 있으면 사용, 없으면 레벨 기반 floor((level-1)/4)+2
     */
    public static int proficiencyBonus(Map<String, Object> character) {
        if (character != null && character.get("proficiencyBonus") instanceof Number n) {
            return n.intValue();
        }
        int level = 1;
        if (character != null && character.get("level") instanceof Number n) {
            level = Math.max(1, n.intValue());
        }
        return Math.floorDiv(level - 1, 4) + 2;
    }

    private static Integer lookupIgnoreCase(Map<?, ?> stats, String key) {
        for (Map.Entry<?, ?> entry : stats.entrySet()) {
            if (String.valueOf(entry.getKey()).equalsIgnoreCase(key.trim())
                && entry.getValue() instanceof Number n) {
                return n.intValue();
            }
        }
        return null;
    }
}

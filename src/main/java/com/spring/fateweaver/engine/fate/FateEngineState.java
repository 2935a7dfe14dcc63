package com.spring.fateweaver.engine.fate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 캠페인별 운명 엔진 상태
 * - momentum: 연속 실패 보정 누적치 (0..10)
 * - turnsSinceCrit: 마지막 크리티컬 이후 경과 굴림 수
 * - directorModeCooldown: 디렉터 모드 발동 여부
 *
 * GameState 문서에는 fateEngine 키 아래 snake_case 맵으로 저장된다.
 */
public record FateEngineState(
    int momentum,
    int turnsSinceCrit,
    boolean directorModeCooldown
) {
    public static final int MAX_MOMENTUM = 10;

    public static final String MOMENTUM_KEY = "momentum_counter";
    public static final String TURNS_SINCE_CRIT_KEY = "last_crit_turn_count";
    public static final String DIRECTOR_COOLDOWN_KEY = "director_mode_cooldown";

    public FateEngineState {
        if (momentum < 0 || momentum > MAX_MOMENTUM) {
            throw new IllegalArgumentException("momentum must be within [0, " + MAX_MOMENTUM + "]: " + momentum);
        }
        if (turnsSinceCrit < 0) {
            throw new IllegalArgumentException("turnsSinceCrit must not be negative: " + turnsSinceCrit);
        }
    }

    public static FateEngineState initial() {
        return new FateEngineState(0, 0, false);
    }

    public FateEngineState withDirectorModeCooldown(boolean cooldown) {
        return new FateEngineState(momentum, turnsSinceCrit, cooldown);
    }

    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put(MOMENTUM_KEY, momentum);
        doc.put(TURNS_SINCE_CRIT_KEY, turnsSinceCrit);
        doc.put(DIRECTOR_COOLDOWN_KEY, directorModeCooldown);
        return doc;
    }

    /**
     * 저장된 문서 → 상태. 형식이 맞지 않으면 IllegalArgumentException
     */
    public static FateEngineState fromDocument(Object raw) {
        if (!(raw instanceof Map<?, ?> doc)) {
            throw new IllegalArgumentException("fateEngine is not an object: " + raw);
        }
        return new FateEngineState(
            intValue(doc.get(MOMENTUM_KEY)),
            intValue(doc.get(TURNS_SINCE_CRIT_KEY)),
            Boolean.TRUE.equals(doc.get(DIRECTOR_COOLDOWN_KEY))
        );
    }

    private static int intValue(Object value) {
        if (value == null) return 0;
        if (value instanceof Number n) return n.intValue();
        throw new IllegalArgumentException("expected a number but got: " + value);
    }
}

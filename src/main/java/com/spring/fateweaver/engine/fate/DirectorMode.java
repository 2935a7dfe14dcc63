package com.spring.fateweaver.engine.fate;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 디렉터 모드: 캐릭터가 위기에 처하면 한 번 난이도를 완화한다.
 * - HP < 25% 또는 mana/stamina/nanites < 20%
 * - 쿨다운 플래그는 캠페인 초기화 전까지 유지된다.
 */
@Component
@Slf4j
public class DirectorMode {

    static final double HEALTH_THRESHOLD = 0.25;
    static final double RESOURCE_THRESHOLD = 0.20;

    private static final List<String> RESOURCE_POOLS = List.of("mana", "stamina", "nanites");

    public record Activation(FateEngineState nextState, String systemMessage) {}

    public Optional<Activation> check(Map<String, Object> character, FateEngineState state) {
        if (state.directorModeCooldown() || character == null) {
            return Optional.empty();
        }

        String reason = null;
        if (ratio(character.get("hp")).filter(r -> r < HEALTH_THRESHOLD).isPresent()) {
            reason = "critical HP";
        } else {
            for (String pool : RESOURCE_POOLS) {
                if (ratio(character.get(pool)).filter(r -> r < RESOURCE_THRESHOLD).isPresent()) {
                    reason = "low " + pool;
                    break;
                }
            }
        }
        if (reason == null) {
            return Optional.empty();
        }

        log.info("🎬 [DIRECTOR] Director mode triggered: {}", reason);
        return Optional.of(new Activation(
            state.withDirectorModeCooldown(true),
            "[Director Mode] Difficulty adjusted - " + reason + " detected. Enemies are less accurate for 2 rounds."
        ));
    }

    /** {current, max} 자원 풀 → 비율. 형식이 아니거나 max <= 0이면 empty */
    private Optional<Double> ratio(Object pool) {
        if (!(pool instanceof Map<?, ?> map)) return Optional.empty();
        if (map.get("current") instanceof Number current && map.get("max") instanceof Number max
            && max.doubleValue() > 0) {
            return Optional.of(current.doubleValue() / max.doubleValue());
        }
        return Optional.empty();
    }
}

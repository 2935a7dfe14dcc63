package com.spring.fateweaver.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * 턴 파이프라인 설정
 */
@ConfigurationProperties(prefix = "game")
public record GameProperties(
    Economy economy,
    Narrator narrator,
    Reviewer reviewer,
    History history,
    Knowledge knowledge,
    TurnLock turnLock,
    ChargeRecovery chargeRecovery
) {
    /**
     * @param modelCosts 모델 id(UI id 또는 실제 id) → 턴 비용
     * @param freeTiers  비용이 부과되지 않는 등급
     */
    public record Economy(int defaultTurnCost, Map<String, Integer> modelCosts, List<String> freeTiers) {
        public Map<String, Integer> costs() {
            return modelCosts == null ? Map.of() : modelCosts;
        }

        public List<String> tiersWithoutCharge() {
            return freeTiers == null ? List.of() : freeTiers;
        }
    }

    public record Narrator(int minWords, int maxWords, boolean enforceWordLimit,
                           int maxOutputTokens, boolean enforceMaxOutputTokens) {}

    /** frequency: N턴마다 한 번 실행 */
    public record Reviewer(boolean enabled, int frequency) {}

    public record History(int brainMessages, int voiceMessages) {}

    public record Knowledge(int brainLimit, int voiceLimit, long cacheTtlSeconds) {}

    public record TurnLock(long ttlSeconds) {}

    /**
     * @param minAgeSeconds 이 시간보다 오래된 PENDING 과금만 재시도 (진행 중인 턴과 경합 방지)
     */
    public record ChargeRecovery(long intervalMs, long minAgeSeconds) {}
}

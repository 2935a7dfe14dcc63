package com.spring.fateweaver.dto.turn;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.spring.fateweaver.domain.enums.UserTier;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.List;
import java.util.Map;

/**
 * 턴 해석 요청
 *
 * @param stateSnapshot 저장된 상태가 없는 첫 턴에만 초기 상태로 사용
 * @param pendingRoll   직전 턴에서 받은 굴림 요청 (rollResult 와 함께 전달)
 * @param rollResult    플레이어가 굴린 자연 주사위 값
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TurnRequest(
    @NotBlank String campaignId,
    @NotBlank String userInput,
    @NotBlank String worldId,
    Map<String, Object> stateSnapshot,
    List<ChatMessage> chatHistory,
    UserTier userTier,
    ProviderKeys providerKeys,
    boolean interactiveDice,
    boolean showSuggestedChoices,
    PendingRoll pendingRoll,
    @Min(1) @Max(20) Integer rollResult
) {
    public List<ChatMessage> history() {
        return chatHistory == null ? List.of() : chatHistory;
    }

    public ProviderKeys keys() {
        return providerKeys == null ? ProviderKeys.none() : providerKeys;
    }

    public boolean resolvesPendingRoll() {
        return pendingRoll != null && rollResult != null;
    }
}

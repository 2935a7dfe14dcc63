package com.spring.fateweaver.service.prompt;

import com.spring.fateweaver.dto.turn.PendingRoll;

import java.util.List;
import java.util.Map;

/**
 * @param historySize 지금까지의 대화 기록 수 (도입부 판단용)
 * @param rollResult  플레이어가 굴린 자연 주사위 값. 굴림 해결 턴이 아니면 null
 */
public record BrainPromptContext(
    WorldProfile world,
    Map<String, Object> state,
    List<String> knowledge,
    int historySize,
    boolean interactiveDice,
    boolean showSuggestedChoices,
    PendingRoll pendingRoll,
    Integer rollResult,
    String userInput
) {
    public boolean resolvingRoll() {
        return rollResult != null;
    }
}

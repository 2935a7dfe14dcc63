package com.spring.fateweaver.dto.turn;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.spring.fateweaver.exception.ErrorCode;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * 턴 해석 결과
 * - requiresUserInput 이면 pendingRoll 또는 pendingChoice 가 채워지고 turnCost 는 0
 * - 실패 시 success=false, errorCode/errorMessage
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TurnResponse(
    boolean success,
    String narrativeText,
    Map<String, Object> stateDelta,
    List<DiceRoll> diceRolls,
    List<String> systemMessages,
    boolean requiresUserInput,
    PendingChoice pendingChoice,
    PendingRoll pendingRoll,
    Integer remainingBalance,
    int turnCost,
    String voiceModelId,
    boolean reviewerApplied,
    boolean chargePending,
    ErrorCode errorCode,
    String errorMessage
) {
    public static TurnResponse failure(ErrorCode code, String message) {
        return TurnResponse.builder()
            .success(false)
            .errorCode(code)
            .errorMessage(message)
            .diceRolls(List.of())
            .systemMessages(List.of())
            .build();
    }
}

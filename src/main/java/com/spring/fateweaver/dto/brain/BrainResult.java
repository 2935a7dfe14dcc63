package com.spring.fateweaver.dto.brain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.spring.fateweaver.dto.turn.DiceRoll;
import com.spring.fateweaver.dto.turn.PendingChoice;
import com.spring.fateweaver.dto.turn.PendingRoll;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Brain(규칙 해석기) 구조화 출력
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BrainResult(
    @NotNull Map<String, Object> stateUpdates,
    @NotNull List<@Valid NarrativeCue> narrativeCues,
    List<@Valid DiceRoll> diceRolls,
    List<String> systemMessages,
    String narrativeCue,
    boolean requiresUserInput,
    @Valid PendingChoice pendingChoice,
    PendingRoll pendingRoll
) {}

package com.spring.fateweaver.dto.turn;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.spring.fateweaver.engine.fate.FateRoll;
import com.spring.fateweaver.engine.fate.ModifierBreakdown;
import com.spring.fateweaver.engine.fate.RollFlags;
import com.spring.fateweaver.engine.fate.RollOutcome;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * 주사위 판정 기록 (응답/Brain 출력 공용)
 * - 엔진이 굴린 판정은 rawRolls, flags, math, outcome 까지 채운다.
 * - total = result + modifier 는 항상 성립하도록 정규화된다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiceRoll(
    @NotBlank String type,
    @NotNull Integer result,
    Integer modifier,
    Integer total,
    String purpose,
    Integer difficulty,
    Boolean success,
    String label,
    List<Integer> rawRolls,
    Integer selectedBase,
    RollFlags flags,
    ModifierBreakdown math,
    RollOutcome outcome
) {
    /** 모델이 보낸 판정: total/success 를 다시 계산 */
    public DiceRoll normalized() {
        int mod = modifier == null ? 0 : modifier;
        int computedTotal = result + mod;
        Boolean computedSuccess = difficulty == null ? success : Boolean.valueOf(computedTotal >= difficulty);
        return new DiceRoll(type, result, mod, computedTotal, purpose, difficulty, computedSuccess, label,
            rawRolls, selectedBase, flags, math, outcome);
    }

    public static DiceRoll fromFate(FateRoll roll, String label) {
        RollOutcome outcome = roll.outcome();
        return new DiceRoll(
            "d20",
            roll.result(),
            roll.modifier(),
            roll.total(),
            roll.purpose(),
            outcome == null ? null : outcome.targetDc(),
            outcome == null ? null : outcome.success(),
            label,
            roll.rawRolls(),
            roll.selectedBase(),
            roll.flags(),
            roll.math(),
            outcome
        );
    }

    public static DiceRoll simple(String notation, int result, int modifier, String purpose, Integer difficulty) {
        return new DiceRoll(notation, result, modifier, null, purpose, difficulty, null, null,
            null, null, null, null, null).normalized();
    }
}

package com.spring.fateweaver.engine.fate;

import java.util.List;

/**
 * 완전히 주석이 달린 d20 판정 기록
 *
 * @param rawRolls     실제 굴린 자연 주사위 값 (유리/불리면 2개, 펌블 보호 재굴림이면 마지막에 추가)
 * @param selectedBase 유리/불리 선택 후의 자연 값
 * @param result       크리티컬/재굴림/모멘텀까지 반영된 최종 다이스 값
 * @param outcome      난이도가 없으면 null
 */
public record FateRoll(
    String purpose,
    List<Integer> rawRolls,
    int selectedBase,
    int result,
    ModifierBreakdown math,
    RollFlags flags,
    RollOutcome outcome
) {
    public int modifier() {
        return math.total();
    }

    public int total() {
        return result + math.total();
    }
}

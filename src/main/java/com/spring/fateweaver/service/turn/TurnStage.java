package com.spring.fateweaver.service.turn;

/**
 * 턴 상태 머신 단계. PERSISTING 이전 단계의 실패는 부수효과가 없다.
 */
public enum TurnStage {
    VALIDATING,
    RESOLVING,
    INTERPRETING,
    AWAITING_ROLL,
    ROLLING,
    MERGING,
    NARRATING,
    REVIEWING,
    PERSISTING,
    CHARGING,
    DONE
}

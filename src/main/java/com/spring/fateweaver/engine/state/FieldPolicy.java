package com.spring.fateweaver.engine.state;

/**
 * GameState 필드별 병합 정책
 */
public enum FieldPolicy {
    /** 추가만 가능. removed는 무시된다 (abilities, spells, essences) */
    IMMUTABLE_ADDITIVE,
    /** {added, removed} 명시 연산으로만 변경. 평배열은 추가 전용으로 취급 */
    PROTECTED_ADDITIVE,
    /** 한 번 설정되면 기존 값 유지 (character.name, rank, class) */
    IDENTITY_PROTECTED,
    /** 이름 → 레코드 맵. 항목 추가/갱신만 가능하고 삭제·정체성 변경 불가 (keyNpcs) */
    PROTECTED_ENTRIES,
    /** 키 단위 얕은 병합 (한 단계 하위 객체까지) */
    SHALLOW_MERGE,
    /** 값 통째로 교체 */
    REPLACE,
    /** 엔진만 쓸 수 있음. 모델 델타는 무시 (fateEngine, questLog, activeQuestId) */
    SYSTEM_MANAGED
}

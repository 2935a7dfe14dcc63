package com.spring.fateweaver.engine.fate;

import lombok.Builder;

import java.util.List;

/**
 * Fate Resolver 입력
 *
 * @param suppliedNaturalRoll 인터랙티브 모드에서 플레이어가 직접 굴린 값 (첫 번째 주사위를 대체)
 * @param difficulty          null이면 성공 판정 없이 총합만 계산
 */
@Builder
public record FateRollRequest(
    String rollType,
    List<String> advantageSources,
    List<String> disadvantageSources,
    int statValue,
    boolean proficient,
    int proficiencyBonus,
    int itemBonus,
    int situationalModifier,
    Integer difficulty,
    Integer suppliedNaturalRoll
) {}

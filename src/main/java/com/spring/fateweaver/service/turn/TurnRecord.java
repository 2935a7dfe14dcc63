package com.spring.fateweaver.service.turn;

import com.spring.fateweaver.external.llm.TokenUsage;

import java.util.Map;

/**
 * 한 턴의 저장 단위: 병합된 상태 + 대화 기록 + 미정산 과금
 *
 * @param usage           모델 키 → 토큰 사용량 (과금 트랜잭션에서 누계)
 * @param expectedVersion 턴 시작 시 읽은 캠페인 버전. 아직 없는 캠페인이면 null
 */
public record TurnRecord(
    String campaignId,
    Long userId,
    String worldId,
    Map<String, Object> state,
    String userInput,
    String narrative,
    String voiceModelId,
    int cost,
    Map<String, TokenUsage> usage,
    Long expectedVersion
) {}

package com.spring.fateweaver.service.turn;

import java.util.Map;

/**
 * 저장된 캠페인 상태 (권위 있는 GameState)
 *
 * @param version 읽은 시점의 행 버전. 저장 시 이 값과 다르면 다른 턴이 먼저 저장한 것
 */
public record CampaignSnapshot(
    String campaignId,
    Long userId,
    String worldId,
    Map<String, Object> state,
    long version
) {}

package com.spring.fateweaver.service.economy;

import com.spring.fateweaver.domain.enums.UserTier;

/**
 * 턴 시작 시점의 계정 스냅샷 (사전 잔액 확인용)
 */
public record AccountView(
    Long userId,
    UserTier tier,
    int balance,
    String brainModel,
    String voiceModel
) {}

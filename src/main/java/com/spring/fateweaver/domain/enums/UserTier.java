package com.spring.fateweaver.domain.enums;

/**
 * 구독 등급. LEGENDARY는 턴 비용이 부과되지 않는다.
 */
public enum UserTier {
    SCOUT,
    HERO,
    LEGEND,
    LEGENDARY
}

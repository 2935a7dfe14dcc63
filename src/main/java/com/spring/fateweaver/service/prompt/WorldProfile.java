package com.spring.fateweaver.service.prompt;

import com.spring.fateweaver.domain.enums.WorldEngine;

/**
 * 턴 해석에 필요한 월드 정보
 *
 * @param rulesText      Brain 규칙 텍스트
 * @param narrativeStyle Voice 문체 지침
 */
public record WorldProfile(
    String id,
    String name,
    WorldEngine engine,
    String rulesText,
    String narrativeStyle
) {}

package com.spring.fateweaver.service.turn;

/**
 * @param token 해제 시 본인 잠금인지 확인하는 값
 */
public record TurnLockHandle(String campaignId, String token) {}

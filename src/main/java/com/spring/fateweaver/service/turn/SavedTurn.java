package com.spring.fateweaver.service.turn;

/**
 * @param pendingChargeId 저장 트랜잭션에서 생성된 PendingCharge
 */
public record SavedTurn(Long pendingChargeId) {}

package com.spring.fateweaver.service.economy;

/**
 * @param charged 실제 차감된 턴 (이미 정산된 건이면 0)
 */
public record ChargeReceipt(int charged, int remainingBalance) {}

package com.spring.fateweaver.service.economy;

/**
 * 턴 원장 포트
 */
public interface EconomyLedger {

    /**
     * @throws com.spring.fateweaver.exception.NotFoundException 계정 없음
     */
    AccountView account(Long userId);

    /**
     * 원자적 과금: 잔액 확인 → 차감 → 사용량 누계 → PendingCharge 정산
     *
     * @throws com.spring.fateweaver.exception.InsufficientBalanceException 잔액 부족 (PendingCharge 는 REJECTED)
     */
    ChargeReceipt charge(ChargeRequest request);
}

package com.spring.fateweaver.domain.enums;

/** 저장 후 과금 상태 */
public enum ChargeStatus {
    PENDING,
    SETTLED,
    REJECTED
}

package com.spring.fateweaver.exception;

/**
 * 에러 코드 표준화
 * - 턴 파이프라인의 실패 분류와 REST 응답 상태 코드를 함께 관리
 */
public enum ErrorCode {
    VALIDATION_ERROR(400),
    FORBIDDEN(403),
    NOT_FOUND(404),
    CONFIGURATION_ERROR(503),
    PROVIDER_FAILURE(502),
    INVALID_RESPONSE(502),
    INSUFFICIENT_BALANCE(402),
    PERSISTENCE_FAILURE(500),
    TURN_IN_PROGRESS(409),
    REVIEWER_FAILURE(500),
    INTERNAL_ERROR(500);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}

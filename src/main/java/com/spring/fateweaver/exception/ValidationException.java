package com.spring.fateweaver.exception;

/** 필수 요청 필드 누락 등, 어떤 작업도 시작하기 전에 거부되는 입력 오류 */
public class ValidationException extends BusinessException {
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}

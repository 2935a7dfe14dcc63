package com.spring.fateweaver.exception;

/** 모델 응답에서 구조화된 JSON 객체를 복구하지 못한 경우 */
public class InvalidResponseException extends BusinessException {
    public InvalidResponseException(String message) {
        super(ErrorCode.INVALID_RESPONSE, message);
    }
}

package com.spring.fateweaver.exception;

/**
 * 상태/대화 기록 저장 실패
 * - 과금 전에 발생하므로 메시지에 "차감되지 않음"을 명시한다.
 */
public class PersistenceFailureException extends BusinessException {

    public static final String NOT_CHARGED_MESSAGE =
        "Failed to save game progress. Your turn was NOT charged. Please try again.";

    public PersistenceFailureException(Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILURE, NOT_CHARGED_MESSAGE, cause);
    }
}

package com.spring.fateweaver.exception;

/** Consistency Reviewer 내부 실패. 리뷰 단계 밖으로 전파되지 않는다. */
public class ReviewerFailureException extends BusinessException {
    public ReviewerFailureException(String message, Throwable cause) {
        super(ErrorCode.REVIEWER_FAILURE, message, cause);
    }
}

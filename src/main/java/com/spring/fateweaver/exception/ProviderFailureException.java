package com.spring.fateweaver.exception;

public class ProviderFailureException extends BusinessException {
    public ProviderFailureException(String message) {
        super(ErrorCode.PROVIDER_FAILURE, message);
    }

    public ProviderFailureException(String message, Throwable cause) {
        super(ErrorCode.PROVIDER_FAILURE, message, cause);
    }
}

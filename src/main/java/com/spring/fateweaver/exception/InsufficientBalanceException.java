package com.spring.fateweaver.exception;

public class InsufficientBalanceException extends BusinessException {

    private final int required;
    private final int available;

    public InsufficientBalanceException(int required, int available) {
        super(ErrorCode.INSUFFICIENT_BALANCE,
            "Insufficient turns. This action costs " + required + " turns, but you only have "
                + available + " turns remaining. Please upgrade your plan or wait for your turns to reset.");
        this.required = required;
        this.available = available;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}

package com.lendingledger.common.exception;

/**
 * Base exception for all lending ledger exceptions.
 */
public class LendingException extends RuntimeException {

    private final LendingErrorCode errorCode;

    public LendingException(LendingErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LendingException(LendingErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public LendingErrorCode getErrorCode() {
        return errorCode;
    }
}

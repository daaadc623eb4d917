package com.lendingledger.common.exception;

/**
 * Thrown when an argument or configured value is rejected, such as a zero
 * duration or a deposit below the policy minimum.
 */
public class InvalidValueException extends LendingException {

    public InvalidValueException(LendingErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}

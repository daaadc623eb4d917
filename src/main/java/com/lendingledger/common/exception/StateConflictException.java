package com.lendingledger.common.exception;

/**
 * Thrown when an operation is not allowed in the current loan, item or membership state.
 */
public class StateConflictException extends LendingException {

    public StateConflictException(LendingErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}

package com.lendingledger.common.exception;

/**
 * Thrown when the per-loan lock could not be acquired within the configured wait.
 */
public class LockAcquisitionException extends LendingException {

    public LockAcquisitionException(String message) {
        super(LendingErrorCode.LOCK_TIMEOUT, message);
    }
}

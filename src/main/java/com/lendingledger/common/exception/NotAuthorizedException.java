package com.lendingledger.common.exception;

/**
 * Thrown when the caller lacks the steward or curator role an operation requires.
 */
public class NotAuthorizedException extends LendingException {

    public NotAuthorizedException(LendingErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static NotAuthorizedException notSteward(String callerId, String operation) {
        return new NotAuthorizedException(LendingErrorCode.NOT_STEWARD,
            String.format("Caller %s is not the steward and cannot %s", callerId, operation));
    }

    public static NotAuthorizedException notStewardOrCurator(String callerId, String operation) {
        return new NotAuthorizedException(LendingErrorCode.NOT_STEWARD_OR_CURATOR,
            String.format("Caller %s is neither steward nor curator and cannot %s", callerId, operation));
    }
}

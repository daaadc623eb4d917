package com.lendingledger.common.exception;

/**
 * Precondition failures reported by the lending ledger.
 *
 * Each code belongs to one category; the category decides which exception
 * type carries it and, at the HTTP edge, which status is returned.
 */
public enum LendingErrorCode {

    NOT_STEWARD(Category.AUTHORIZATION),
    NOT_STEWARD_OR_CURATOR(Category.AUTHORIZATION),
    NOT_MEMBER(Category.AUTHORIZATION),

    NO_SUCH_ITEM(Category.NOT_FOUND),
    NO_SUCH_LOAN(Category.NOT_FOUND),

    ITEM_PAUSED(Category.STATE_CONFLICT),
    ACTIVE_LOAN_EXISTS(Category.STATE_CONFLICT),
    UNAVAILABLE(Category.STATE_CONFLICT),
    NOT_HOLDER(Category.STATE_CONFLICT),
    NO_ACTIVE_LOAN(Category.STATE_CONFLICT),
    MAX_EXTENSIONS_REACHED(Category.STATE_CONFLICT),
    INSUFFICIENT_UNITS(Category.STATE_CONFLICT),

    BRANCH_UNSET(Category.INVALID_VALUE),
    DEPOSIT_TOO_LOW(Category.INVALID_VALUE),
    ZERO_DURATION(Category.INVALID_VALUE),
    ZERO_DEPOSIT(Category.INVALID_VALUE),
    ZERO_BRANCH(Category.INVALID_VALUE),
    INVALID_AMOUNT(Category.INVALID_VALUE),
    INVALID_ACCOUNT(Category.INVALID_VALUE),
    MISSING_METADATA(Category.INVALID_VALUE),

    INSUFFICIENT_FUNDS(Category.INVALID_VALUE),

    LOCK_TIMEOUT(Category.UNAVAILABLE);

    public enum Category {
        AUTHORIZATION,
        NOT_FOUND,
        STATE_CONFLICT,
        INVALID_VALUE,
        UNAVAILABLE
    }

    private final Category category;

    LendingErrorCode(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * Build the exception type matching this code's category.
     */
    public LendingException toException(String message) {
        return switch (category) {
            case AUTHORIZATION -> new NotAuthorizedException(this, message);
            case NOT_FOUND -> new ResourceNotFoundException(this, message);
            case STATE_CONFLICT -> new StateConflictException(this, message);
            case INVALID_VALUE -> new InvalidValueException(this, message);
            case UNAVAILABLE -> new LockAcquisitionException(message);
        };
    }
}

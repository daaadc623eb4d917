package com.lendingledger.common.exception;

/**
 * Thrown when an item or loan does not exist.
 */
public class ResourceNotFoundException extends LendingException {

    public ResourceNotFoundException(LendingErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static ResourceNotFoundException item(Long itemId) {
        return new ResourceNotFoundException(LendingErrorCode.NO_SUCH_ITEM, "Catalog item not found: " + itemId);
    }

    public static ResourceNotFoundException loan(String borrowerId, Long itemId) {
        return new ResourceNotFoundException(LendingErrorCode.NO_SUCH_LOAN,
            String.format("No loan of item %d to %s", itemId, borrowerId));
    }
}

package com.flagship.tool_ledger.custody;

public enum ErrorKind {
    ITEM_NOT_FOUND(ErrorCategory.NOT_FOUND),
    STAFF_NOT_FOUND(ErrorCategory.NOT_FOUND),
    ALREADY_CHECKED_OUT(ErrorCategory.PRECONDITION_FAILED),
    NOT_CHECKED_OUT(ErrorCategory.PRECONDITION_FAILED),
    STAFF_INACTIVE(ErrorCategory.PRECONDITION_FAILED),
    INSUFFICIENT_QUANTITY(ErrorCategory.PRECONDITION_FAILED),
    TRANSACTION_CONFLICT(ErrorCategory.TRANSACTION_CONFLICT);

    private final ErrorCategory category;

    ErrorKind(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}

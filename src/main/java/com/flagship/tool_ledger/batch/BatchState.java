package com.flagship.tool_ledger.batch;

public enum BatchState {
    EMPTY,
    CHECKOUT,
    CHECKIN,
    CONSUMABLE_USAGE,
    CONSUMABLE_RESTOCK,
    SUBMITTING
}

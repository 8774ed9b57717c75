package com.flagship.tool_ledger.batch;

import com.flagship.tool_ledger.history.HistoryAction;

public enum BatchType {
    CHECKOUT(HistoryAction.CHECKOUT, false),
    CHECKIN(HistoryAction.CHECKIN, false),
    CONSUMABLE_USAGE(HistoryAction.USAGE, true),
    CONSUMABLE_RESTOCK(HistoryAction.RESTOCK, true);

    private final HistoryAction action;
    private final boolean consumable;

    BatchType(HistoryAction action, boolean consumable) {
        this.action = action;
        this.consumable = consumable;
    }

    public HistoryAction getAction() {
        return action;
    }

    public boolean isConsumable() {
        return consumable;
    }
}

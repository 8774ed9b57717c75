package com.flagship.tool_ledger.history;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum HistoryAction {
    CHECKOUT("checkout"),
    CHECKIN("checkin"),
    USAGE("usage"),
    RESTOCK("restock");

    private final String value;

    HistoryAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static HistoryAction fromValue(String value) {
        for (HistoryAction action : values()) {
            if (action.value.equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown history action: " + value);
    }
}

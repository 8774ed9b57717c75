package com.flagship.tool_ledger.inventory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ToolStatus {
    AVAILABLE("available"),
    CHECKED_OUT("checked_out");

    private final String value;

    ToolStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ToolStatus fromValue(String value) {
        for (ToolStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown tool status: " + value);
    }
}

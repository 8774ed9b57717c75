package com.flagship.tool_ledger.inventory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StaffRole {
    ADMIN,
    SUPERVISOR,
    WORKER;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Unknown roles degrade to {@link #WORKER}, the least privileged one.
     */
    @JsonCreator
    public static StaffRole fromValue(String value) {
        if (value == null) {
            return WORKER;
        }
        for (StaffRole role : values()) {
            if (role.name().equalsIgnoreCase(value)) {
                return role;
            }
        }
        return WORKER;
    }
}

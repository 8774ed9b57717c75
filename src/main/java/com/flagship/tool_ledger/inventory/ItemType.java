package com.flagship.tool_ledger.inventory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of tracked item, with the collection its documents live in and the
 * prefix of its printed unique id.
 */
public enum ItemType {
    TOOL("tool", "tools", "T", "TOOL#"),
    CONSUMABLE("consumable", "consumables", "C", "CONSUMABLE#");

    private final String value;
    private final String collection;
    private final String codePrefix;
    private final String payloadPrefix;

    ItemType(String value, String collection, String codePrefix, String payloadPrefix) {
        this.value = value;
        this.collection = collection;
        this.codePrefix = codePrefix;
        this.payloadPrefix = payloadPrefix;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getCollection() {
        return collection;
    }

    public String getCodePrefix() {
        return codePrefix;
    }

    public String getPayloadPrefix() {
        return payloadPrefix;
    }

    @JsonCreator
    public static ItemType fromValue(String value) {
        for (ItemType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown item type: " + value);
    }
}

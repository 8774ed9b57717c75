package com.flagship.tool_ledger.inventory;

import lombok.Value;

/**
 * Resolved identity of a scanned or typed item code.
 */
@Value
public class ItemKey {
    ItemType type;
    String itemId;
    String uniqueId;
}

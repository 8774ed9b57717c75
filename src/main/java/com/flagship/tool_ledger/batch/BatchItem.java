package com.flagship.tool_ledger.batch;

import com.flagship.tool_ledger.inventory.ItemType;
import lombok.Value;

import java.math.BigDecimal;

/**
 * An item accepted into a batch. {@code quantity} is set for consumables only.
 */
@Value
public class BatchItem {
    ItemType itemType;
    String itemId;
    String uniqueId;
    String displayName;
    BigDecimal quantity;
}

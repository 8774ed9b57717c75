package com.flagship.tool_ledger.batch;

import com.flagship.tool_ledger.inventory.Consumable;
import com.flagship.tool_ledger.inventory.ItemType;
import com.flagship.tool_ledger.inventory.Tool;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A batch being assembled by one operator.
 *
 * The batch type is fixed by the first accepted tool (available starts a checkout batch,
 * checked out starts a checkin batch), or chosen up front with {@link #selectType} for
 * consumables. Every later scan must agree with it. Rejected scans leave the session
 * untouched. Clearing, or a fully successful submit, returns it to EMPTY.
 *
 * All methods are synchronized; a session may be shared between request threads.
 */
public class BatchSession {

    private final String sessionId;
    private final String actingStaffUid;
    private final Map<String, BatchItem> items = new LinkedHashMap<>();
    private BatchType type;
    private boolean submitting;
    private Instant lastTouched;

    public BatchSession(String sessionId, String actingStaffUid, Instant now) {
        this.sessionId = sessionId;
        this.actingStaffUid = actingStaffUid;
        this.lastTouched = now;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getActingStaffUid() {
        return actingStaffUid;
    }

    public synchronized BatchType getType() {
        return type;
    }

    public synchronized BatchState getState() {
        if (submitting) {
            return BatchState.SUBMITTING;
        }
        if (type == null) {
            return BatchState.EMPTY;
        }
        return BatchState.valueOf(type.name());
    }

    public synchronized List<BatchItem> getItems() {
        return List.copyOf(items.values());
    }

    public synchronized Instant getLastTouched() {
        return lastTouched;
    }

    synchronized void touch(Instant now) {
        lastTouched = now;
    }

    /**
     * Chooses a consumable batch type. Only allowed while the batch is empty.
     */
    public synchronized void selectType(BatchType selected) {
        ensureNotSubmitting(null);
        if (selected == null || !selected.isConsumable()) {
            throw new IllegalArgumentException("Only consumable batch types can be selected; tool batches are inferred");
        }
        if (type != null && type != selected) {
            throw new BatchValidationException(ScanRejection.TYPE_MISMATCH, null,
                "Batch is already a " + type + " batch");
        }
        type = selected;
    }

    public synchronized BatchItem scan(Tool tool) {
        ensureNotSubmitting(tool.getUniqueId());
        ensureNotPresent(tool.getId(), tool.getUniqueId());

        BatchType implied = tool.isAvailable() ? BatchType.CHECKOUT : BatchType.CHECKIN;
        if (type != null && type != implied) {
            throw new BatchValidationException(ScanRejection.TYPE_MISMATCH, tool.getUniqueId(), String.format(
                "%s is %s but this is a %s batch", tool.getUniqueId(),
                tool.isAvailable() ? "available" : "checked out", type));
        }
        BatchItem item = new BatchItem(ItemType.TOOL, tool.getId(), tool.getUniqueId(), tool.getDisplayName(), null);
        type = implied;
        items.put(tool.getId(), item);
        return item;
    }

    public synchronized BatchItem scanConsumable(Consumable consumable, BigDecimal quantity) {
        ensureNotSubmitting(consumable.getUniqueId());
        if (quantity == null || quantity.signum() <= 0) {
            throw new BatchValidationException(ScanRejection.INVALID_QUANTITY, consumable.getUniqueId(),
                "Quantity must be positive");
        }
        ensureNotPresent(consumable.getId(), consumable.getUniqueId());
        if (type == null) {
            throw new BatchValidationException(ScanRejection.TYPE_NOT_SELECTED, consumable.getUniqueId(),
                "Select usage or restock before scanning consumables");
        }
        if (!type.isConsumable()) {
            throw new BatchValidationException(ScanRejection.TYPE_MISMATCH, consumable.getUniqueId(),
                "Consumables cannot join a " + type + " batch");
        }
        BatchItem item = new BatchItem(ItemType.CONSUMABLE, consumable.getId(), consumable.getUniqueId(),
            consumable.getName(), quantity);
        items.put(consumable.getId(), item);
        return item;
    }

    /**
     * Removing the last tool drops the inferred type; a selected consumable type stays.
     */
    public synchronized boolean remove(String itemId) {
        ensureNotSubmitting(null);
        boolean removed = items.remove(itemId) != null;
        if (items.isEmpty() && type != null && !type.isConsumable()) {
            type = null;
        }
        return removed;
    }

    public synchronized void clear() {
        ensureNotSubmitting(null);
        items.clear();
        type = null;
    }

    /**
     * Freezes the batch for submission and returns its items in scan order.
     */
    synchronized List<BatchItem> beginSubmit() {
        ensureNotSubmitting(null);
        if (items.isEmpty()) {
            throw new BatchValidationException(ScanRejection.EMPTY_BATCH, null, "Nothing to submit");
        }
        submitting = true;
        return new ArrayList<>(items.values());
    }

    /**
     * Unfreezes the batch, dropping the items that went through. Whatever failed (or was
     * never attempted) stays for a retry; with nothing left the session is back to EMPTY.
     */
    synchronized void completeSubmit(Set<String> succeededItemIds) {
        items.keySet().removeAll(succeededItemIds);
        if (items.isEmpty()) {
            type = null;
        }
        submitting = false;
    }

    private void ensureNotSubmitting(String uniqueId) {
        if (submitting) {
            throw new BatchValidationException(ScanRejection.BATCH_SUBMITTED, uniqueId,
                "Batch " + sessionId + " is being submitted");
        }
    }

    private void ensureNotPresent(String itemId, String uniqueId) {
        if (items.containsKey(itemId)) {
            throw new BatchValidationException(ScanRejection.ALREADY_IN_BATCH, uniqueId,
                uniqueId + " is already in this batch");
        }
    }
}

package com.flagship.tool_ledger.custody;

import com.flagship.tool_ledger.history.EntryMetadata;
import com.flagship.tool_ledger.history.GlobalHistoryLedger;
import com.flagship.tool_ledger.history.HistoryAction;
import com.flagship.tool_ledger.history.HistoryEntry;
import com.flagship.tool_ledger.history.ItemHistoryLedger;
import com.flagship.tool_ledger.inventory.Consumable;
import com.flagship.tool_ledger.inventory.ItemType;
import com.flagship.tool_ledger.inventory.Staff;
import com.flagship.tool_ledger.inventory.Tool;
import com.flagship.tool_ledger.inventory.ToolStatus;
import com.flagship.tool_ledger.observability.CorrelationContext;
import com.flagship.tool_ledger.observability.CustodyMetrics;
import com.flagship.tool_ledger.store.DocumentMapper;
import com.flagship.tool_ledger.store.DocumentRef;
import com.flagship.tool_ledger.store.DocumentSnapshot;
import com.flagship.tool_ledger.store.DocumentStore;
import com.flagship.tool_ledger.store.FieldValue;
import com.flagship.tool_ledger.store.TransactionConflictException;
import com.flagship.tool_ledger.store.TransactionFunction;
import com.flagship.tool_ledger.store.TransactionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Custody engine for tools and consumables.
 *
 * Every operation runs in two phases:
 * 1. Atomic phase: one store transaction re-reads the item (and staff) documents,
 *    checks preconditions, and writes the new custody state, the instant-status fields
 *    and the staff assignment list together.
 * 2. Best-effort phase: after commit, the history entry is appended to the per-item
 *    ledger and then to the global ledger. Each append is attempted independently and
 *    a failure is logged, never rethrown.
 *
 * Custody state is the source of truth; the ledgers may lag or miss an entry. The
 * history entry timestamp is the transaction's commit time, the same instant written
 * to {@code lastAssignedAt} / {@code lastCheckinAt}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CustodyService {

    private final DocumentStore store;
    private final DocumentMapper mapper;
    private final ItemHistoryLedger itemLedger;
    private final GlobalHistoryLedger globalLedger;
    private final CustodyMetrics metrics;

    public CustodyReceipt checkout(String toolId, String staffUid, String actingStaffUid) {
        return performCheckout(toolId, staffUid, actingStaffUid, null, null);
    }

    public CustodyReceipt checkin(String toolId, String actingStaffUid) {
        return performCheckin(toolId, actingStaffUid, null, null);
    }

    /**
     * Assigns an available tool to an active staff member.
     *
     * @throws CustodyException ITEM_NOT_FOUND, STAFF_NOT_FOUND, STAFF_INACTIVE,
     *                          ALREADY_CHECKED_OUT or TRANSACTION_CONFLICT
     */
    public CustodyReceipt performCheckout(String toolId, String staffUid, String actingStaffUid,
                                          String notes, String batchId) {
        requireId(staffUid, "staffUid");
        return instrumented(HistoryAction.CHECKOUT, toolId, batchId, () -> {
            Staff actor = requireActingStaff(actingStaffUid, toolId);
            DocumentRef toolRef = Tool.refFor(toolId);
            DocumentRef staffRef = Staff.refFor(staffUid);

            // Phase 1: status change and assignment commit together or not at all
            TransactionResult<CheckoutState> committed = atomically(toolId, txn -> {
                // Load tool and target staff under the transaction (latest state)
                DocumentSnapshot toolSnapshot = txn.get(toolRef);
                DocumentSnapshot staffSnapshot = txn.get(staffRef);
                Tool tool = requireTool(toolSnapshot, toolId);
                if (!staffSnapshot.exists()) {
                    throw new CustodyException(ErrorKind.STAFF_NOT_FOUND, toolId, "Staff not found: " + staffUid);
                }
                Staff staff = mapper.toObject(staffSnapshot, Staff.class);
                if (!staff.isActive()) {
                    throw new CustodyException(ErrorKind.STAFF_INACTIVE, toolId,
                        "Staff " + staff.getFullName() + " is not active");
                }
                if (!tool.isAvailable()) {
                    throw new CustodyException(ErrorKind.ALREADY_CHECKED_OUT, toolId,
                        "Tool " + tool.getUniqueId() + " is already checked out");
                }

                // Instant status: who holds it, who handed it out, and when
                Map<String, Object> toolPatch = new LinkedHashMap<>();
                toolPatch.put("status", ToolStatus.CHECKED_OUT.getValue());
                toolPatch.put("currentHolderRef", staffUid);
                toolPatch.put("lastAssignedToName", staff.getFullName());
                toolPatch.put("lastAssignedToJobCode", staff.getJobCode());
                toolPatch.put("lastAssignedByName", actor.getFullName());
                toolPatch.put("lastAssignedAt", FieldValue.serverTimestamp());
                toolPatch.put("updatedAt", FieldValue.serverTimestamp());
                txn.update(toolRef, toolPatch);

                List<String> assigned = new ArrayList<>(staff.getAssignedItemIds());
                if (!assigned.contains(toolId)) {
                    assigned.add(toolId);
                }
                txn.update(staffRef, assignmentPatch(assigned));
                return new CheckoutState(tool, staff);
            });

            // Phase 2: history, timestamped with the commit time (best effort)
            Tool tool = committed.getValue().tool();
            Staff staff = committed.getValue().staff();
            HistoryEntry entry = HistoryEntry.builder()
                .id(UUID.randomUUID().toString())
                .action(HistoryAction.CHECKOUT)
                .itemType(ItemType.TOOL)
                .itemId(toolId)
                .itemUniqueId(tool.getUniqueId())
                .byStaffUid(actingStaffUid)
                .assignedToStaffUid(staffUid)
                .batchId(batchId)
                .notes(notes)
                .timestamp(committed.getCommitTime())
                .metadata(EntryMetadata.builder()
                    .staffName(staff.getFullName())
                    .staffJobCode(staff.getJobCode())
                    .itemName(tool.getDisplayName())
                    .adminName(actor.getFullName())
                    .build())
                .build();
            recordHistory(entry);

            log.info("Tool checked out: uniqueId={}, staff={}, by={}, attempts={}",
                tool.getUniqueId(), staffUid, actingStaffUid, committed.getAttempts());
            return receiptFor(entry, null);
        });
    }

    /**
     * Returns a checked-out tool to stock and removes it from the holder's assignments.
     *
     * @throws CustodyException ITEM_NOT_FOUND, STAFF_NOT_FOUND (acting staff),
     *                          NOT_CHECKED_OUT or TRANSACTION_CONFLICT
     */
    public CustodyReceipt performCheckin(String toolId, String actingStaffUid, String notes, String batchId) {
        return instrumented(HistoryAction.CHECKIN, toolId, batchId, () -> {
            Staff actor = requireActingStaff(actingStaffUid, toolId);
            DocumentRef toolRef = Tool.refFor(toolId);

            // Phase 1: release the tool and drop it from the holder's assignments
            TransactionResult<CheckinState> committed = atomically(toolId, txn -> {
                Tool tool = requireTool(txn.get(toolRef), toolId);
                if (!tool.isCheckedOut()) {
                    throw new CustodyException(ErrorKind.NOT_CHECKED_OUT, toolId,
                        "Tool " + tool.getUniqueId() + " is not checked out");
                }
                String holderUid = tool.getCurrentHolderRef();
                Staff holder = null;
                if (holderUid != null) {
                    DocumentSnapshot holderSnapshot = txn.get(Staff.refFor(holderUid));
                    if (holderSnapshot.exists()) {
                        holder = mapper.toObject(holderSnapshot, Staff.class);
                    }
                }

                Map<String, Object> toolPatch = new LinkedHashMap<>();
                toolPatch.put("status", ToolStatus.AVAILABLE.getValue());
                toolPatch.put("currentHolderRef", null);
                toolPatch.put("lastCheckinAt", FieldValue.serverTimestamp());
                toolPatch.put("lastCheckinByName", holder != null ? holder.getFullName() : actor.getFullName());
                toolPatch.put("updatedAt", FieldValue.serverTimestamp());
                txn.update(toolRef, toolPatch);

                if (holder != null) {
                    List<String> assigned = new ArrayList<>(holder.getAssignedItemIds());
                    assigned.remove(toolId);
                    txn.update(Staff.refFor(holderUid), assignmentPatch(assigned));
                }
                return new CheckinState(tool, holderUid, holder);
            });

            // Phase 2: history (best effort)
            CheckinState state = committed.getValue();
            if (state.holder() == null) {
                log.warn("Holder {} of tool {} no longer exists; assignment list not updated",
                    state.holderUid(), state.tool().getUniqueId());
            }
            HistoryEntry entry = HistoryEntry.builder()
                .id(UUID.randomUUID().toString())
                .action(HistoryAction.CHECKIN)
                .itemType(ItemType.TOOL)
                .itemId(toolId)
                .itemUniqueId(state.tool().getUniqueId())
                .byStaffUid(actingStaffUid)
                .assignedToStaffUid(state.holderUid())
                .batchId(batchId)
                .notes(notes)
                .timestamp(committed.getCommitTime())
                .metadata(EntryMetadata.builder()
                    .staffName(state.holder() != null ? state.holder().getFullName() : null)
                    .staffJobCode(state.holder() != null ? state.holder().getJobCode() : null)
                    .itemName(state.tool().getDisplayName())
                    .adminName(actor.getFullName())
                    .build())
                .build();
            recordHistory(entry);

            log.info("Tool checked in: uniqueId={}, previousHolder={}, by={}, attempts={}",
                state.tool().getUniqueId(), state.holderUid(), actingStaffUid, committed.getAttempts());
            return receiptFor(entry, null);
        });
    }

    /**
     * Takes {@code quantity} out of stock on behalf of {@code usedByUid}.
     *
     * @throws IllegalArgumentException if the quantity is not positive
     * @throws CustodyException ITEM_NOT_FOUND, STAFF_NOT_FOUND, STAFF_INACTIVE,
     *                          INSUFFICIENT_QUANTITY or TRANSACTION_CONFLICT
     */
    public CustodyReceipt recordUsage(String consumableId, BigDecimal quantity, String usedByUid,
                                      String actingStaffUid, String notes, String batchId) {
        requirePositive(quantity);
        requireId(usedByUid, "usedByUid");
        return instrumented(HistoryAction.USAGE, consumableId, batchId, () -> {
            Staff actor = requireActingStaff(actingStaffUid, consumableId);
            DocumentRef consumableRef = Consumable.refFor(consumableId);
            DocumentRef usedByRef = Staff.refFor(usedByUid);

            TransactionResult<QuantityState> committed = atomically(consumableId, txn -> {
                DocumentSnapshot consumableSnapshot = txn.get(consumableRef);
                DocumentSnapshot usedBySnapshot = txn.get(usedByRef);
                Consumable consumable = requireConsumable(consumableSnapshot, consumableId);
                if (!usedBySnapshot.exists()) {
                    throw new CustodyException(ErrorKind.STAFF_NOT_FOUND, consumableId, "Staff not found: " + usedByUid);
                }
                Staff usedBy = mapper.toObject(usedBySnapshot, Staff.class);
                if (!usedBy.isActive()) {
                    throw new CustodyException(ErrorKind.STAFF_INACTIVE, consumableId,
                        "Staff " + usedBy.getFullName() + " is not active");
                }
                BigDecimal before = quantityOf(consumable);
                if (before.compareTo(quantity) < 0) {
                    throw new CustodyException(ErrorKind.INSUFFICIENT_QUANTITY, consumableId,
                        String.format("Only %s %s of %s left, %s requested",
                            before.toPlainString(), consumable.getUnit(), consumable.getUniqueId(), quantity.toPlainString()));
                }
                BigDecimal after = before.subtract(quantity);

                Map<String, Object> patch = new LinkedHashMap<>();
                patch.put("currentQuantity", after);
                patch.put("lastAssignedToName", usedBy.getFullName());
                patch.put("lastAssignedToJobCode", usedBy.getJobCode());
                patch.put("lastAssignedByName", actor.getFullName());
                patch.put("lastAssignedAt", FieldValue.serverTimestamp());
                patch.put("updatedAt", FieldValue.serverTimestamp());
                txn.update(consumableRef, patch);
                return new QuantityState(consumable, usedBy, before, after);
            });

            QuantityState state = committed.getValue();
            HistoryEntry entry = quantityEntry(HistoryAction.USAGE, state, quantity.negate(), actor, notes, batchId,
                committed)
                .assignedToStaffUid(usedByUid)
                .metadata(EntryMetadata.builder()
                    .staffName(state.staff().getFullName())
                    .staffJobCode(state.staff().getJobCode())
                    .itemName(state.consumable().getName())
                    .adminName(actor.getFullName())
                    .build())
                .build();
            recordHistory(entry);

            log.info("Consumable used: uniqueId={}, quantity={}, remaining={}, usedBy={}, by={}",
                state.consumable().getUniqueId(), quantity, state.after(), usedByUid, actingStaffUid);
            return receiptFor(entry, state.after());
        });
    }

    /**
     * Adds {@code quantity} back to stock.
     *
     * @throws IllegalArgumentException if the quantity is not positive
     * @throws CustodyException ITEM_NOT_FOUND, STAFF_NOT_FOUND (acting staff) or TRANSACTION_CONFLICT
     */
    public CustodyReceipt recordRestock(String consumableId, BigDecimal quantity, String actingStaffUid,
                                        String notes, String batchId) {
        requirePositive(quantity);
        return instrumented(HistoryAction.RESTOCK, consumableId, batchId, () -> {
            Staff actor = requireActingStaff(actingStaffUid, consumableId);
            DocumentRef consumableRef = Consumable.refFor(consumableId);

            TransactionResult<QuantityState> committed = atomically(consumableId, txn -> {
                Consumable consumable = requireConsumable(txn.get(consumableRef), consumableId);
                BigDecimal before = quantityOf(consumable);
                BigDecimal after = before.add(quantity);

                Map<String, Object> patch = new LinkedHashMap<>();
                patch.put("currentQuantity", after);
                patch.put("lastCheckinAt", FieldValue.serverTimestamp());
                patch.put("lastCheckinByName", actor.getFullName());
                patch.put("updatedAt", FieldValue.serverTimestamp());
                txn.update(consumableRef, patch);
                return new QuantityState(consumable, actor, before, after);
            });

            QuantityState state = committed.getValue();
            HistoryEntry entry = quantityEntry(HistoryAction.RESTOCK, state, quantity, actor, notes, batchId, committed)
                .metadata(EntryMetadata.builder()
                    .itemName(state.consumable().getName())
                    .adminName(actor.getFullName())
                    .build())
                .build();
            recordHistory(entry);

            log.info("Consumable restocked: uniqueId={}, quantity={}, now={}, by={}",
                state.consumable().getUniqueId(), quantity, state.after(), actingStaffUid);
            return receiptFor(entry, state.after());
        });
    }

    // ==================== Best-effort phase ====================

    /**
     * Appends the entry to both ledgers, each independently. Failures are logged and counted.
     */
    private void recordHistory(HistoryEntry entry) {
        try {
            itemLedger.append(entry);
            metrics.recordLedgerWrite("item", true);
        } catch (RuntimeException e) {
            metrics.recordLedgerWrite("item", false);
            log.warn("Item ledger write failed: bucket={}, entryId={}, error={}",
                describeBucket(() -> itemLedger.bucketFor(entry)), entry.getId(), e.getMessage());
        }
        try {
            globalLedger.append(entry);
            metrics.recordLedgerWrite("global", true);
        } catch (RuntimeException e) {
            metrics.recordLedgerWrite("global", false);
            log.warn("Global ledger write failed: bucket={}, entryId={}, error={}",
                describeBucket(() -> globalLedger.bucketFor(entry)), entry.getId(), e.getMessage());
        }
    }

    private static String describeBucket(Supplier<DocumentRef> bucket) {
        try {
            return bucket.get().getPath();
        } catch (RuntimeException e) {
            return "unknown (" + e.getMessage() + ")";
        }
    }

    // ==================== Helpers ====================

    private CustodyReceipt instrumented(HistoryAction action, String itemId, String batchId,
                                        Supplier<CustodyReceipt> operation) {
        requireId(itemId, "itemId");
        long startTime = System.currentTimeMillis();
        boolean ownsBatchKey = batchId != null && MDC.get(CorrelationContext.BATCH_ID_MDC_KEY) == null;
        MDC.put(CorrelationContext.ITEM_ID_MDC_KEY, itemId);
        if (ownsBatchKey) {
            MDC.put(CorrelationContext.BATCH_ID_MDC_KEY, batchId);
        }
        try {
            CustodyReceipt receipt = operation.get();
            metrics.recordOperation(action.getValue(), "success");
            return receipt;
        } catch (CustodyException e) {
            metrics.recordOperation(action.getValue(), e.getKind().name());
            log.warn("{} rejected: kind={}, message={}", action.getValue(), e.getKind(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordOperation(action.getValue(), "error");
            log.error("{} failed unexpectedly: {}", action.getValue(), e.getMessage(), e);
            throw e;
        } finally {
            metrics.recordLatency(action.getValue(), System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.ITEM_ID_MDC_KEY);
            if (ownsBatchKey) {
                MDC.remove(CorrelationContext.BATCH_ID_MDC_KEY);
            }
        }
    }

    private <T> TransactionResult<T> atomically(String itemId, TransactionFunction<T> function) {
        try {
            return store.runTransaction(function);
        } catch (TransactionConflictException e) {
            throw new CustodyException(ErrorKind.TRANSACTION_CONFLICT, itemId,
                "Too much contention on item " + itemId + ", please retry", e);
        }
    }

    private Staff requireActingStaff(String actingStaffUid, String itemId) {
        requireId(actingStaffUid, "actingStaffUid");
        DocumentSnapshot snapshot = store.get(Staff.refFor(actingStaffUid));
        if (!snapshot.exists()) {
            throw new CustodyException(ErrorKind.STAFF_NOT_FOUND, itemId, "Acting staff not found: " + actingStaffUid);
        }
        return mapper.toObject(snapshot, Staff.class);
    }

    private Tool requireTool(DocumentSnapshot snapshot, String toolId) {
        if (!snapshot.exists()) {
            throw new CustodyException(ErrorKind.ITEM_NOT_FOUND, toolId, "Tool not found: " + toolId);
        }
        return mapper.toObject(snapshot, Tool.class);
    }

    private Consumable requireConsumable(DocumentSnapshot snapshot, String consumableId) {
        if (!snapshot.exists()) {
            throw new CustodyException(ErrorKind.ITEM_NOT_FOUND, consumableId, "Consumable not found: " + consumableId);
        }
        return mapper.toObject(snapshot, Consumable.class);
    }

    private static Map<String, Object> assignmentPatch(List<String> assignedItemIds) {
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("assignedItemIds", assignedItemIds);
        patch.put("updatedAt", FieldValue.serverTimestamp());
        return patch;
    }

    private static HistoryEntry.HistoryEntryBuilder quantityEntry(HistoryAction action, QuantityState state,
                                                                  BigDecimal change, Staff actor, String notes,
                                                                  String batchId, TransactionResult<?> committed) {
        return HistoryEntry.builder()
            .id(UUID.randomUUID().toString())
            .action(action)
            .itemType(ItemType.CONSUMABLE)
            .itemId(state.consumable().getId())
            .itemUniqueId(state.consumable().getUniqueId())
            .byStaffUid(actor.getUid())
            .batchId(batchId)
            .notes(notes)
            .timestamp(committed.getCommitTime())
            .quantityBefore(state.before())
            .quantityChange(change)
            .quantityAfter(state.after());
    }

    private static CustodyReceipt receiptFor(HistoryEntry entry, BigDecimal quantityAfter) {
        return CustodyReceipt.builder()
            .entryId(entry.getId())
            .action(entry.getAction())
            .itemType(entry.getItemType())
            .itemId(entry.getItemId())
            .itemUniqueId(entry.getItemUniqueId())
            .staffUid(entry.getAssignedToStaffUid())
            .actingStaffUid(entry.getByStaffUid())
            .batchId(entry.getBatchId())
            .committedAt(entry.getTimestamp())
            .quantityAfter(quantityAfter)
            .build();
    }

    private static BigDecimal quantityOf(Consumable consumable) {
        return consumable.getCurrentQuantity() == null ? BigDecimal.ZERO : consumable.getCurrentQuantity();
    }

    private static void requirePositive(BigDecimal quantity) {
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
    }

    private static void requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    private record CheckoutState(Tool tool, Staff staff) {}

    private record CheckinState(Tool tool, String holderUid, Staff holder) {}

    private record QuantityState(Consumable consumable, Staff staff, BigDecimal before, BigDecimal after) {}
}

package com.flagship.tool_ledger.batch;

import com.flagship.tool_ledger.custody.CustodyException;
import com.flagship.tool_ledger.custody.CustodyReceipt;
import com.flagship.tool_ledger.custody.CustodyService;
import com.flagship.tool_ledger.inventory.Consumable;
import com.flagship.tool_ledger.inventory.InventoryService;
import com.flagship.tool_ledger.inventory.ItemDirectory;
import com.flagship.tool_ledger.inventory.ItemKey;
import com.flagship.tool_ledger.inventory.ItemStatusCache;
import com.flagship.tool_ledger.inventory.ItemType;
import com.flagship.tool_ledger.inventory.Tool;
import com.flagship.tool_ledger.observability.CorrelationContext;
import com.flagship.tool_ledger.observability.CustodyMetrics;
import com.flagship.tool_ledger.store.ServerClock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Builds batches from scans and submits them.
 *
 * Scan-time checks use the item status cache and only keep a batch homogeneous; the
 * authoritative checks happen again per item inside the custody transaction at submit.
 * Submission walks the items sequentially, one independent custody transaction each,
 * all tagged with one {@code BATCH_} id. A failing item is reported and does not stop
 * the rest.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BatchCoordinator {

    static final String BATCH_ID_PREFIX = "BATCH_";

    private final ItemDirectory directory;
    private final ItemStatusCache cache;
    private final InventoryService inventory;
    private final CustodyService custody;
    private final CustodyMetrics metrics;
    private final ServerClock clock;

    public BatchSession startBatch(String actingStaffUid) {
        if (actingStaffUid == null || actingStaffUid.isBlank()) {
            throw new IllegalArgumentException("actingStaffUid is required");
        }
        return new BatchSession(UUID.randomUUID().toString(), actingStaffUid, clock.peek());
    }

    /**
     * Adds a scanned item to the batch.
     *
     * @param quantity required for consumables, ignored for tools
     * @throws BatchValidationException if the item is unknown, already present, or does
     *                                  not fit the batch type
     */
    public BatchItem scanIntoBatch(BatchSession session, String scannedCode, BigDecimal quantity) {
        session.touch(clock.peek());
        ItemKey key = directory.resolve(scannedCode)
            .orElseThrow(() -> new BatchValidationException(ScanRejection.ITEM_NOT_FOUND,
                ItemDirectory.normalize(scannedCode), "No item with code " + ItemDirectory.normalize(scannedCode)));

        BatchItem item;
        if (key.getType() == ItemType.TOOL) {
            Tool tool = cache.tool(key.getItemId())
                .or(() -> inventory.findTool(key.getItemId()))
                .orElseThrow(() -> notFound(key));
            item = session.scan(tool);
        } else {
            Consumable consumable = cache.consumable(key.getItemId())
                .or(() -> inventory.findConsumable(key.getItemId()))
                .orElseThrow(() -> notFound(key));
            item = session.scanConsumable(consumable, quantity);
        }
        log.debug("Scanned {} into batch session {} ({})", key.getUniqueId(), session.getSessionId(), session.getType());
        return item;
    }

    public BatchItem scanIntoBatch(BatchSession session, String scannedCode) {
        return scanIntoBatch(session, scannedCode, null);
    }

    /**
     * Submits every item of the batch.
     *
     * @param targetStaffUid receiving staff for checkout batches (required) and usage
     *                       batches (defaults to the acting staff); ignored otherwise
     */
    public BatchReport submitBatch(BatchSession session, String targetStaffUid, String notes) {
        session.touch(clock.peek());
        BatchType pendingType = session.getType();
        if (pendingType == BatchType.CHECKOUT && (targetStaffUid == null || targetStaffUid.isBlank())) {
            throw new IllegalArgumentException("A checkout batch needs the staff member receiving the tools");
        }

        // Freeze the session; scans are refused until completeSubmit
        List<BatchItem> items = session.beginSubmit();
        BatchType type = session.getType();
        String batchId = BATCH_ID_PREFIX + UUID.randomUUID();
        String batchNotes = notes != null && !notes.isBlank()
            ? notes
            : String.format("Batch %s (%s)", type.getAction().getValue(), batchId);

        MDC.put(CorrelationContext.BATCH_ID_MDC_KEY, batchId);
        List<ItemOutcome> outcomes = new ArrayList<>();
        Set<String> succeeded = new HashSet<>();
        try {
            log.info("Submitting batch: type={}, items={}, actingStaff={}", type, items.size(), session.getActingStaffUid());
            // Each item is its own atomic operation; one failure never aborts the rest
            for (BatchItem item : items) {
                ItemOutcome outcome = submitItem(type, item, session.getActingStaffUid(), targetStaffUid, batchNotes, batchId);
                outcomes.add(outcome);
                if (outcome.isSuccess()) {
                    succeeded.add(item.getItemId());
                }
            }
        } finally {
            // Failed items stay in the session for a retry
            session.completeSubmit(succeeded);
            MDC.remove(CorrelationContext.BATCH_ID_MDC_KEY);
        }

        // Record metrics
        BatchReport report = BatchReport.of(batchId, type, outcomes);
        metrics.recordBatchSubmitted(type.name().toLowerCase(Locale.ROOT), report.isFullySuccessful()
            ? "success"
            : report.getSuccessCount() > 0 ? "partial" : "failed");
        log.info("Batch {} finished: succeeded={}, failed={}", batchId, report.getSuccessCount(), report.getFailureCount());
        return report;
    }

    public void clearBatch(BatchSession session) {
        session.touch(clock.peek());
        session.clear();
    }

    private ItemOutcome submitItem(BatchType type, BatchItem item, String actingStaffUid,
                                   String targetStaffUid, String notes, String batchId) {
        try {
            CustodyReceipt receipt = switch (type) {
                case CHECKOUT -> custody.performCheckout(item.getItemId(), targetStaffUid, actingStaffUid, notes, batchId);
                case CHECKIN -> custody.performCheckin(item.getItemId(), actingStaffUid, notes, batchId);
                case CONSUMABLE_USAGE -> custody.recordUsage(item.getItemId(), item.getQuantity(),
                    targetStaffUid != null && !targetStaffUid.isBlank() ? targetStaffUid : actingStaffUid,
                    actingStaffUid, notes, batchId);
                case CONSUMABLE_RESTOCK -> custody.recordRestock(item.getItemId(), item.getQuantity(),
                    actingStaffUid, notes, batchId);
            };
            return ItemOutcome.builder()
                .itemId(item.getItemId())
                .uniqueId(item.getUniqueId())
                .success(true)
                .entryId(receipt.getEntryId())
                .committedAt(receipt.getCommittedAt())
                .build();
        } catch (CustodyException e) {
            return ItemOutcome.builder()
                .itemId(item.getItemId())
                .uniqueId(item.getUniqueId())
                .success(false)
                .errorKind(e.getKind())
                .errorCategory(e.getCategory())
                .message(e.getMessage())
                .build();
        } catch (RuntimeException e) {
            log.error("Batch item {} failed unexpectedly: {}", item.getUniqueId(), e.getMessage(), e);
            return ItemOutcome.builder()
                .itemId(item.getItemId())
                .uniqueId(item.getUniqueId())
                .success(false)
                .message(e.getMessage())
                .build();
        }
    }

    private static BatchValidationException notFound(ItemKey key) {
        return new BatchValidationException(ScanRejection.ITEM_NOT_FOUND, key.getUniqueId(),
            "Item " + key.getUniqueId() + " is registered but its record is missing");
    }
}

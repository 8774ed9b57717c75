package com.flagship.tool_ledger.custody;

import com.flagship.tool_ledger.custody.dto.CheckinRequest;
import com.flagship.tool_ledger.custody.dto.CheckoutRequest;
import com.flagship.tool_ledger.custody.dto.CustodyResponse;
import com.flagship.tool_ledger.custody.dto.QuantityRequest;
import com.flagship.tool_ledger.custody.dto.ToolStatusResponse;
import com.flagship.tool_ledger.inventory.InventoryService;
import com.flagship.tool_ledger.inventory.ItemDirectory;
import com.flagship.tool_ledger.inventory.ItemKey;
import com.flagship.tool_ledger.inventory.ItemType;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for single-item custody operations.
 *
 * Items are addressed by their scanned code. An optional Idempotency-Key header makes a
 * retried request return the first outcome instead of failing on the state it created
 * (a repeated checkout would otherwise answer ALREADY_CHECKED_OUT). A retry that arrives
 * while the first request is still running waits for it and gets the same outcome.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class CustodyController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final CustodyService custodyService;
    private final IdempotencyService idempotencyService;
    private final ItemDirectory itemDirectory;
    private final InventoryService inventoryService;

    @PostMapping("/tools/{uniqueId}/checkout")
    public ResponseEntity<CustodyResponse> checkout(
            @PathVariable("uniqueId") String uniqueId,
            @Valid @RequestBody CheckoutRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        ItemKey tool = resolve(uniqueId, ItemType.TOOL);
        log.info("Received checkout request: tool={}, staff={}, by={}",
                tool.getUniqueId(), request.getStaffUid(), request.getActingStaffUid());

        CustodyReceipt receipt = idempotencyService.execute(idempotencyKey, "checkout:" + tool.getItemId(),
            CustodyReceipt.class,
            () -> custodyService.performCheckout(tool.getItemId(), request.getStaffUid(),
                request.getActingStaffUid(), request.getNotes(), null));
        return ResponseEntity.ok(CustodyResponse.from(receipt));
    }

    @PostMapping("/tools/{uniqueId}/checkin")
    public ResponseEntity<CustodyResponse> checkin(
            @PathVariable("uniqueId") String uniqueId,
            @Valid @RequestBody CheckinRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        ItemKey tool = resolve(uniqueId, ItemType.TOOL);
        log.info("Received checkin request: tool={}, by={}", tool.getUniqueId(), request.getActingStaffUid());

        CustodyReceipt receipt = idempotencyService.execute(idempotencyKey, "checkin:" + tool.getItemId(),
            CustodyReceipt.class,
            () -> custodyService.performCheckin(tool.getItemId(), request.getActingStaffUid(), request.getNotes(), null));
        return ResponseEntity.ok(CustodyResponse.from(receipt));
    }

    @PostMapping("/consumables/{uniqueId}/usage")
    public ResponseEntity<CustodyResponse> recordUsage(
            @PathVariable("uniqueId") String uniqueId,
            @Valid @RequestBody QuantityRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        ItemKey consumable = resolve(uniqueId, ItemType.CONSUMABLE);
        String usedBy = request.getUsedByUid() != null && !request.getUsedByUid().isBlank()
            ? request.getUsedByUid()
            : request.getActingStaffUid();

        CustodyReceipt receipt = idempotencyService.execute(idempotencyKey, "usage:" + consumable.getItemId(),
            CustodyReceipt.class,
            () -> custodyService.recordUsage(consumable.getItemId(), request.getQuantity(), usedBy,
                request.getActingStaffUid(), request.getNotes(), null));
        return ResponseEntity.ok(CustodyResponse.from(receipt));
    }

    @PostMapping("/consumables/{uniqueId}/restock")
    public ResponseEntity<CustodyResponse> recordRestock(
            @PathVariable("uniqueId") String uniqueId,
            @Valid @RequestBody QuantityRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        ItemKey consumable = resolve(uniqueId, ItemType.CONSUMABLE);

        CustodyReceipt receipt = idempotencyService.execute(idempotencyKey, "restock:" + consumable.getItemId(),
            CustodyReceipt.class,
            () -> custodyService.recordRestock(consumable.getItemId(), request.getQuantity(),
                request.getActingStaffUid(), request.getNotes(), null));
        return ResponseEntity.ok(CustodyResponse.from(receipt));
    }

    /**
     * Gets the instant status of a tool straight from its document.
     */
    @GetMapping("/tools/{uniqueId}")
    public ResponseEntity<ToolStatusResponse> getTool(@PathVariable("uniqueId") String uniqueId) {
        ItemKey tool = resolve(uniqueId, ItemType.TOOL);
        return inventoryService.findTool(tool.getItemId())
            .map(found -> ResponseEntity.ok(ToolStatusResponse.from(found)))
            .orElse(ResponseEntity.notFound().build());
    }

    private ItemKey resolve(String code, ItemType expected) {
        return itemDirectory.resolve(code, expected)
            .orElseThrow(() -> new CustodyException(ErrorKind.ITEM_NOT_FOUND, null,
                "No " + expected.getValue() + " with code " + ItemDirectory.normalize(code)));
    }
}

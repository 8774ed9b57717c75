package com.flagship.tool_ledger.inventory;

import com.flagship.tool_ledger.custody.dto.ConsumableStatusResponse;
import com.flagship.tool_ledger.custody.dto.ToolStatusResponse;
import com.flagship.tool_ledger.inventory.dto.RegisterConsumableRequest;
import com.flagship.tool_ledger.inventory.dto.RegisterStaffRequest;
import com.flagship.tool_ledger.inventory.dto.RegisterToolRequest;
import com.flagship.tool_ledger.inventory.dto.StaffActiveRequest;
import com.flagship.tool_ledger.inventory.dto.StaffResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Registration and lookup of tools, consumables and staff.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class InventoryController {

    private final InventoryService inventoryService;
    private final ItemDirectory itemDirectory;

    @PostMapping("/tools")
    public ResponseEntity<ToolStatusResponse> registerTool(@Valid @RequestBody RegisterToolRequest request) {
        Tool tool = inventoryService.registerTool(request.getUniqueId(), request.getName(),
            request.getBrand(), request.getModel());
        return ResponseEntity.status(HttpStatus.CREATED).body(ToolStatusResponse.from(tool));
    }

    @GetMapping("/tools")
    public ResponseEntity<List<ToolStatusResponse>> listTools() {
        return ResponseEntity.ok(inventoryService.listTools().stream().map(ToolStatusResponse::from).toList());
    }

    @PostMapping("/consumables")
    public ResponseEntity<ConsumableStatusResponse> registerConsumable(
            @Valid @RequestBody RegisterConsumableRequest request) {
        Consumable consumable = inventoryService.registerConsumable(request.getUniqueId(), request.getName(),
            request.getUnit(), request.getInitialQuantity(), request.getMinQuantity());
        return ResponseEntity.status(HttpStatus.CREATED).body(ConsumableStatusResponse.from(consumable));
    }

    @GetMapping("/consumables")
    public ResponseEntity<List<ConsumableStatusResponse>> listConsumables(
            @RequestParam(value = "low_stock", defaultValue = "false") boolean lowStockOnly) {
        return ResponseEntity.ok(inventoryService.listConsumables().stream()
            .filter(consumable -> !lowStockOnly || consumable.isLowStock())
            .map(ConsumableStatusResponse::from)
            .toList());
    }

    @GetMapping("/consumables/{uniqueId}")
    public ResponseEntity<ConsumableStatusResponse> getConsumable(@PathVariable("uniqueId") String uniqueId) {
        return itemDirectory.resolve(uniqueId, ItemType.CONSUMABLE)
            .flatMap(key -> inventoryService.findConsumable(key.getItemId()))
            .map(consumable -> ResponseEntity.ok(ConsumableStatusResponse.from(consumable)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/staff")
    public ResponseEntity<StaffResponse> registerStaff(@Valid @RequestBody RegisterStaffRequest request) {
        Staff staff = inventoryService.registerStaff(request.getFullName(), request.getJobCode(), request.getRole());
        return ResponseEntity.status(HttpStatus.CREATED).body(StaffResponse.from(staff));
    }

    @GetMapping("/staff/{uid}")
    public ResponseEntity<StaffResponse> getStaff(@PathVariable("uid") String uid) {
        return inventoryService.findStaff(uid)
            .map(staff -> ResponseEntity.ok(StaffResponse.from(staff)))
            .orElseThrow(() -> new NoSuchElementException("Staff not found: " + uid));
    }

    @PutMapping("/staff/{uid}/active")
    public ResponseEntity<StaffResponse> setActive(@PathVariable("uid") String uid,
                                                   @Valid @RequestBody StaffActiveRequest request) {
        Staff staff = inventoryService.setStaffActive(uid, request.getActive());
        return ResponseEntity.ok(StaffResponse.from(staff));
    }

    /**
     * Tools currently held by a staff member.
     */
    @GetMapping("/staff/{uid}/tools")
    public ResponseEntity<List<ToolStatusResponse>> toolsHeldBy(@PathVariable("uid") String uid) {
        return ResponseEntity.ok(inventoryService.findToolsAssignedTo(uid).stream()
            .map(ToolStatusResponse::from)
            .toList());
    }
}

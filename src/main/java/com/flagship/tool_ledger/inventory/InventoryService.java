package com.flagship.tool_ledger.inventory;

import com.flagship.tool_ledger.store.DocumentMapper;
import com.flagship.tool_ledger.store.DocumentRef;
import com.flagship.tool_ledger.store.DocumentSnapshot;
import com.flagship.tool_ledger.store.DocumentStore;
import com.flagship.tool_ledger.store.FieldValue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * Registration and lookup of tools, consumables and staff.
 *
 * Custody fields are never written here; they belong to the custody transactions.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InventoryService {

    private final DocumentStore store;
    private final DocumentMapper mapper;

    public Tool registerTool(String uniqueId, String name, String brand, String model) {
        String code = requireCode(uniqueId, ItemType.TOOL);
        Tool tool = Tool.builder()
            .id(UUID.randomUUID().toString())
            .uniqueId(code)
            .name(requireText(name, "name"))
            .brand(brand)
            .model(model)
            .status(ToolStatus.AVAILABLE)
            .build();
        register(new ItemKey(ItemType.TOOL, tool.getId(), code), Tool.refFor(tool.getId()), mapper.toMap(tool));
        log.info("Registered tool: uniqueId={}, id={}", code, tool.getId());
        return findTool(tool.getId()).orElseThrow();
    }

    public Consumable registerConsumable(String uniqueId, String name, String unit,
                                         BigDecimal initialQuantity, BigDecimal minQuantity) {
        String code = requireCode(uniqueId, ItemType.CONSUMABLE);
        if (initialQuantity == null || initialQuantity.signum() < 0) {
            throw new IllegalArgumentException("Initial quantity must be zero or positive");
        }
        Consumable consumable = Consumable.builder()
            .id(UUID.randomUUID().toString())
            .uniqueId(code)
            .name(requireText(name, "name"))
            .unit(unit)
            .currentQuantity(initialQuantity)
            .minQuantity(minQuantity == null ? BigDecimal.ZERO : minQuantity)
            .build();
        register(new ItemKey(ItemType.CONSUMABLE, consumable.getId(), code),
            Consumable.refFor(consumable.getId()), mapper.toMap(consumable));
        log.info("Registered consumable: uniqueId={}, id={}, quantity={}", code, consumable.getId(), initialQuantity);
        return findConsumable(consumable.getId()).orElseThrow();
    }

    public Staff registerStaff(String fullName, String jobCode, StaffRole role) {
        Staff staff = Staff.builder()
            .uid(UUID.randomUUID().toString())
            .fullName(requireText(fullName, "fullName"))
            .jobCode(requireText(jobCode, "jobCode"))
            .role(role == null ? StaffRole.WORKER : role)
            .active(true)
            .build();
        Map<String, Object> data = withTimestamps(mapper.toMap(staff));
        store.set(Staff.refFor(staff.getUid()), data, false);
        log.info("Registered staff: uid={}, jobCode={}", staff.getUid(), staff.getJobCode());
        return findStaff(staff.getUid()).orElseThrow();
    }

    public Staff setStaffActive(String uid, boolean active) {
        if (!store.get(Staff.refFor(uid)).exists()) {
            throw new NoSuchElementException("Staff not found: " + uid);
        }
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("active", active);
        patch.put("updatedAt", FieldValue.serverTimestamp());
        store.set(Staff.refFor(uid), patch, true);
        log.info("Staff {} marked {}", uid, active ? "active" : "inactive");
        return findStaff(uid).orElseThrow();
    }

    public Optional<Tool> findTool(String id) {
        return find(Tool.refFor(id), Tool.class);
    }

    public Optional<Consumable> findConsumable(String id) {
        return find(Consumable.refFor(id), Consumable.class);
    }

    public Optional<Staff> findStaff(String uid) {
        return find(Staff.refFor(uid), Staff.class);
    }

    public List<Tool> listTools() {
        return store.list(Tool.COLLECTION).stream()
            .map(snapshot -> mapper.toObject(snapshot, Tool.class))
            .toList();
    }

    public List<Consumable> listConsumables() {
        return store.list(Consumable.COLLECTION).stream()
            .map(snapshot -> mapper.toObject(snapshot, Consumable.class))
            .toList();
    }

    /**
     * Tools currently held by a staff member, resolved from their assignment list.
     */
    public List<Tool> findToolsAssignedTo(String staffUid) {
        Staff staff = findStaff(staffUid)
            .orElseThrow(() -> new NoSuchElementException("Staff not found: " + staffUid));
        return staff.getAssignedItemIds().stream()
            .map(this::findTool)
            .flatMap(Optional::stream)
            .filter(tool -> staffUid.equals(tool.getCurrentHolderRef()))
            .toList();
    }

    private void register(ItemKey key, DocumentRef itemRef, Map<String, Object> itemData) {
        DocumentRef indexRef = ItemDirectory.refFor(key.getUniqueId());
        Map<String, Object> data = withTimestamps(itemData);
        store.runTransaction(txn -> {
            if (txn.get(indexRef).exists()) {
                throw new IllegalArgumentException("Unique id already registered: " + key.getUniqueId());
            }
            txn.set(itemRef, data, false);
            txn.set(indexRef, ItemDirectory.indexEntry(key), false);
            return null;
        });
    }

    private <T> Optional<T> find(DocumentRef ref, Class<T> type) {
        DocumentSnapshot snapshot = store.get(ref);
        return snapshot.exists() ? Optional.of(mapper.toObject(snapshot, type)) : Optional.empty();
    }

    private static Map<String, Object> withTimestamps(Map<String, Object> data) {
        data.put("createdAt", FieldValue.serverTimestamp());
        data.put("updatedAt", FieldValue.serverTimestamp());
        return data;
    }

    private static String requireCode(String uniqueId, ItemType type) {
        String code = ItemDirectory.normalize(uniqueId);
        if (ItemDirectory.typeOf(code).orElse(null) != type) {
            throw new IllegalArgumentException(
                String.format("%s codes must start with '%s': %s", type.getValue(), type.getCodePrefix(), code));
        }
        return code;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }
}

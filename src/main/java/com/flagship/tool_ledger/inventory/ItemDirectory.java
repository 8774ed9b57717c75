package com.flagship.tool_ledger.inventory;

import com.flagship.tool_ledger.store.DocumentRef;
import com.flagship.tool_ledger.store.DocumentSnapshot;
import com.flagship.tool_ledger.store.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps printed item codes to internal ids.
 *
 * Every registered item has an index document at {@code item_codes/{uniqueId}} written in
 * the same transaction as the item itself. Codes never change once registered, so
 * resolved entries are cached for the life of the process.
 */
@Component
@Slf4j
public class ItemDirectory {

    public static final String COLLECTION = "item_codes";

    private final DocumentStore store;
    private final ConcurrentMap<String, ItemKey> resolved = new ConcurrentHashMap<>();

    public ItemDirectory(DocumentStore store) {
        this.store = store;
    }

    /**
     * Accepts a bare unique id ({@code T1234}) or a QR payload ({@code TOOL#T1234},
     * {@code CONSUMABLE#C0001}) and returns the upper-cased unique id.
     */
    public static String normalize(String scannedCode) {
        if (scannedCode == null || scannedCode.isBlank()) {
            throw new IllegalArgumentException("Item code is required");
        }
        String code = scannedCode.trim();
        int hash = code.lastIndexOf('#');
        if (hash >= 0) {
            code = code.substring(hash + 1);
        }
        if (code.isEmpty()) {
            throw new IllegalArgumentException("Item code is empty: " + scannedCode);
        }
        return code.toUpperCase(Locale.ROOT);
    }

    /**
     * Item type implied by the code prefix, if any.
     */
    public static Optional<ItemType> typeOf(String uniqueId) {
        for (ItemType type : ItemType.values()) {
            if (uniqueId.startsWith(type.getCodePrefix())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static DocumentRef refFor(String uniqueId) {
        return DocumentRef.of(COLLECTION, uniqueId);
    }

    public Optional<ItemKey> resolve(String scannedCode) {
        String uniqueId = normalize(scannedCode);
        ItemKey cached = resolved.get(uniqueId);
        if (cached != null) {
            return Optional.of(cached);
        }
        DocumentSnapshot snapshot = store.get(refFor(uniqueId));
        if (!snapshot.exists()) {
            log.debug("No item registered for code {}", uniqueId);
            return Optional.empty();
        }
        ItemKey key = new ItemKey(
            ItemType.fromValue((String) snapshot.get("itemType")),
            (String) snapshot.get("itemId"),
            uniqueId);
        resolved.put(uniqueId, key);
        return Optional.of(key);
    }

    /**
     * Resolves a code that must belong to an item of the given type.
     */
    public Optional<ItemKey> resolve(String scannedCode, ItemType expected) {
        return resolve(scannedCode).filter(key -> key.getType() == expected);
    }

    static Map<String, Object> indexEntry(ItemKey key) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("uniqueId", key.getUniqueId());
        data.put("itemType", key.getType().getValue());
        data.put("itemId", key.getItemId());
        return data;
    }
}

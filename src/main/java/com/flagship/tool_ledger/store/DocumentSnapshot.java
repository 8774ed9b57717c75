package com.flagship.tool_ledger.store;

import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of a document.
 *
 * Missing documents are represented by a snapshot with {@code null} data and version 0,
 * so callers never have to distinguish "absent" from "error" by exception.
 */
@Value
public class DocumentSnapshot {
    DocumentRef ref;
    Map<String, Object> data;
    long version;

    public static DocumentSnapshot missing(DocumentRef ref) {
        return new DocumentSnapshot(ref, null, 0L);
    }

    public static DocumentSnapshot of(DocumentRef ref, Map<String, Object> data, long version) {
        if (data == null) {
            return missing(ref);
        }
        return new DocumentSnapshot(ref, Collections.unmodifiableMap(DocumentValues.deepCopy(data)), version);
    }

    public boolean exists() {
        return data != null;
    }

    public Object get(String field) {
        return data == null ? null : data.get(field);
    }

    /**
     * Returns an array field as a list of maps, or an empty list when absent.
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getMapList(String field) {
        Object value = get(field);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new IllegalStateException("Field '" + field + "' of " + ref + " is not an array");
        }
        return (List<Map<String, Object>>) value;
    }
}

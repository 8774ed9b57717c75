package com.flagship.tool_ledger.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the plain map/list trees documents are made of.
 */
final class DocumentValues {

    private DocumentValues() {
        // Utility class
    }

    /**
     * Copies nested maps and lists so stored state never aliases caller-owned collections.
     * Leaf values (strings, numbers, instants) are immutable and shared.
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> deepCopy(Map<String, Object> source) {
        if (source == null) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            return deepCopy((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (List<Object>) value) {
                copy.add(copyValue(element));
            }
            return copy;
        }
        return value;
    }

    /**
     * Replaces every {@link FieldValue#SERVER_TIMESTAMP} sentinel in the tree with {@code now}.
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> resolveSentinels(Map<String, Object> source, Instant now) {
        if (source == null) {
            return null;
        }
        Map<String, Object> resolved = new LinkedHashMap<>();
        source.forEach((key, value) -> resolved.put(key, resolveValue(value, now)));
        return resolved;
    }

    @SuppressWarnings("unchecked")
    private static Object resolveValue(Object value, Instant now) {
        if (value == FieldValue.SERVER_TIMESTAMP) {
            return now;
        }
        if (value instanceof Map) {
            return resolveSentinels((Map<String, Object>) value, now);
        }
        if (value instanceof List) {
            List<Object> resolved = new ArrayList<>();
            for (Object element : (List<Object>) value) {
                resolved.add(resolveValue(element, now));
            }
            return resolved;
        }
        return value;
    }

    /**
     * Top-level field merge: fields present in {@code patch} replace those in {@code base}.
     */
    static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> patch) {
        Map<String, Object> merged = base == null ? new LinkedHashMap<>() : deepCopy(base);
        merged.putAll(deepCopy(patch));
        return merged;
    }
}

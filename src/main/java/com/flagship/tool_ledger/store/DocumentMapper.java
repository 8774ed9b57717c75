package com.flagship.tool_ledger.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between typed domain values and the map form documents are stored in.
 */
@Component
public class DocumentMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public DocumentMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> toMap(Object value) {
        return new LinkedHashMap<>(objectMapper.convertValue(value, MAP_TYPE));
    }

    public <T> T toObject(Map<String, Object> data, Class<T> type) {
        return objectMapper.convertValue(data, type);
    }

    /**
     * @throws IllegalArgumentException if the snapshot is of a missing document
     */
    public <T> T toObject(DocumentSnapshot snapshot, Class<T> type) {
        if (!snapshot.exists()) {
            throw new IllegalArgumentException("Document does not exist: " + snapshot.getRef());
        }
        return toObject(snapshot.getData(), type);
    }
}

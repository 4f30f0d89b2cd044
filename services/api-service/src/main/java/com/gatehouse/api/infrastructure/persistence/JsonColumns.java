package com.gatehouse.api.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gatehouse.security.StorageException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the JSON text columns ({@code scopes}, {@code data}).
 */
@Component
class JsonColumns {

    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String writeObject(Map<String, Object> value) {
        return value == null ? null : write(value);
    }

    String writeStrings(Collection<String> value) {
        return value == null ? null : write(List.copyOf(value));
    }

    Map<String, Object> readObject(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, OBJECT);
        } catch (JsonProcessingException e) {
            throw new StorageException("Stored JSON object is corrupt", e);
        }
    }

    Set<String> readStrings(String json) {
        if (json == null || json.isBlank()) {
            return Set.of();
        }
        try {
            return new LinkedHashSet<>(objectMapper.readValue(json, STRINGS));
        } catch (JsonProcessingException e) {
            throw new StorageException("Stored JSON array is corrupt", e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be stored as JSON", e);
        }
    }
}

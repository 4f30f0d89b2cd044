package com.gatehouse.observability;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks credentials in payloads before they are logged or echoed back in an error body.
 * <p>
 * A map entry is masked when its key contains one of the sensitive fragments, ignoring case, so
 * {@code password} also catches {@code hashed_password} and {@code token} catches
 * {@code access_token}. Maps and collections are walked to any depth; other values pass through.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_FRAGMENTS = Set.of(
            "password", "token", "secret", "authorization", "credential");

    private final List<String> fragments;

    public SensitiveDataRedactor() {
        this(DEFAULT_FRAGMENTS);
    }

    /**
     * @param fragments key fragments to mask, matched case-insensitively
     */
    public SensitiveDataRedactor(Set<String> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            throw new IllegalArgumentException("fragments must not be null or empty");
        }
        this.fragments = fragments.stream()
                .map(fragment -> fragment.toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * Returns a masked copy of {@code data}, keeping key order. Null yields an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> result.put(key, isSensitive(key) ? REDACTED : redactValue(value)));
        return result;
    }

    /**
     * Masks sensitive entries of any maps reachable from {@code value}. Scalars are returned as-is.
     */
    public Object redactValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> keyed = new LinkedHashMap<>(map.size());
            map.forEach((k, v) -> keyed.put(String.valueOf(k), v));
            return redact(keyed);
        }
        if (value instanceof Collection<?> items) {
            List<Object> result = new ArrayList<>(items.size());
            for (Object item : items) {
                result.add(redactValue(item));
            }
            return result;
        }
        return value;
    }

    public boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        for (String fragment : fragments) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}

package com.memfacade.memory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the loosely shaped payloads a {@link MemoryStore} returns onto {@link MemoryRecord}.
 * Every field has one ordered list of source keys; the first non-null value wins, except
 * for the type, where a blank value also falls through to the next key.
 */
public final class ResultNormalizer {

    static final List<String> ID_KEYS = List.of("id", "memory_id");
    static final List<String> CONTENT_KEYS = List.of("memory", "content", "data");
    static final List<String> TYPE_KEYS = List.of("type", "memory_type");

    private ResultNormalizer() {}

    public static MemoryRecord normalize(Map<String, Object> entry) {
        return normalize(entry, null);
    }

    // fallbackId covers update responses that omit the id
    public static MemoryRecord normalize(Map<String, Object> entry, String fallbackId) {
        var id = resolveId(entry);
        if (id == null) id = fallbackId;
        if (id == null) {
            throw new IllegalArgumentException("Memory payload has no id: " + entry.keySet());
        }
        return toRecord(entry, id);
    }

    // analytics keep entries without an id; the record id stays null
    public static MemoryRecord normalizeForScan(Map<String, Object> entry) {
        return toRecord(entry, resolveId(entry));
    }

    private static MemoryRecord toRecord(Map<String, Object> entry, String id) {
        return new MemoryRecord(
            id,
            resolveContent(entry),
            text(entry.get("user_id")),
            text(entry.get("agent_id")),
            text(entry.get("run_id")),
            coerceMetadata(entry.get("metadata"), Map.of()),
            text(entry.get("created_at")),
            text(entry.get("updated_at")),
            toDouble(entry.get("importance")),
            toInt(entry.get("access_count")),
            resolveType(entry, null)
        );
    }

    /**
     * Builds a record straight from an {@code add} result entry. A field present with a
     * non-null value in the entry wins; otherwise the caller's input is used.
     */
    public static MemoryRecord fromCreateResult(Map<String, Object> entry, String id,
                                                NewMemory input, Identity identity) {
        var content = resolveContent(entry);
        return new MemoryRecord(
            id,
            content != null ? content : input.content(),
            preferEntry(entry, "user_id", identity.userId()),
            preferEntry(entry, "agent_id", identity.agentId()),
            preferEntry(entry, "run_id", identity.runId()),
            coerceMetadata(entry.get("metadata"), input.metadata()),
            text(entry.get("created_at")),
            text(entry.get("updated_at")),
            toDouble(entry.get("importance")),
            toInt(entry.get("access_count")),
            resolveType(entry, input.type())
        );
    }

    public static String resolveId(Map<String, Object> entry) {
        return firstText(entry, ID_KEYS);
    }

    public static String resolveContent(Map<String, Object> entry) {
        return firstText(entry, CONTENT_KEYS);
    }

    // results[0].id, then top-level memory_id, then top-level id
    @SuppressWarnings("unchecked")
    public static String extractCreatedId(Map<String, Object> addResult) {
        if (addResult == null) return null;
        var results = results(addResult);
        if (!results.isEmpty()) {
            var first = results.get(0);
            return first instanceof Map ? text(((Map<String, Object>) first).get("id")) : null;
        }
        if (addResult.containsKey("memory_id")) return text(addResult.get("memory_id"));
        if (addResult.containsKey("id")) return text(addResult.get("id"));
        return null;
    }

    public static List<?> results(Map<String, Object> response) {
        if (response == null) return List.of();
        var value = response.get("results");
        return value instanceof List ? (List<?>) value : List.of();
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> coerceMetadata(Object value, Map<String, Object> fallback) {
        if (value == null) {
            return fallback != null ? new LinkedHashMap<>(fallback) : new LinkedHashMap<>();
        }
        if (value instanceof Map) {
            var copy = new LinkedHashMap<String, Object>();
            ((Map<Object, Object>) value).forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        return new LinkedHashMap<>();
    }

    static Double toDouble(Object value) {
        if (value instanceof Number) return ((Number) value).doubleValue();
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static int toInt(Object value) {
        if (value instanceof Number) return ((Number) value).intValue();
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    private static String preferEntry(Map<String, Object> entry, String key, String fallback) {
        var value = entry.get(key);
        return value != null ? value.toString() : fallback;
    }

    private static String resolveType(Map<String, Object> entry, String fallback) {
        for (var key : TYPE_KEYS) {
            var value = entry.get(key);
            if (value != null && !value.toString().isBlank()) return value.toString();
        }
        return fallback;
    }

    private static String firstText(Map<String, Object> entry, List<String> keys) {
        for (var key : keys) {
            var value = entry.get(key);
            if (value != null) return value.toString();
        }
        return null;
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }
}

package com.memfacade.memory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical memory shape returned to callers. Built by {@link ResultNormalizer};
 * {@code metadata} is never null. Timestamps are kept as the store reported them.
 */
public record MemoryRecord(
    String id,
    String content,
    String userId,
    String agentId,
    String runId,
    Map<String, Object> metadata,
    String createdAt,
    String updatedAt,
    Double importance,
    int accessCount,
    String type
) {
    public MemoryRecord {
        content = content != null ? content : "";
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    public MemoryRecord withContent(String newContent) {
        return new MemoryRecord(id, newContent, userId, agentId, runId, metadata,
                createdAt, updatedAt, importance, accessCount, type);
    }
}

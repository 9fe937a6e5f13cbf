package com.memfacade.memory;

import java.util.List;
import java.util.Map;

/**
 * Record store consumed by the service layer. Responses are loosely typed maps whose
 * exact shape belongs to the implementation; {@link ResultNormalizer} turns them into
 * {@link MemoryRecord}s.
 */
public interface MemoryStore {

    Map<String, Object> add(String content, Identity identity, Map<String, Object> metadata,
                            Map<String, Object> filters, String scope, String type, boolean infer);

    Map<String, Object> get(String memoryId, Identity identity);

    Map<String, Object> getRawPayload(String memoryId);

    Map<String, Object> getAll(Identity identity, int limit, int offset, String sortBy, String order);

    Map<String, Object> update(String memoryId, String content, Identity identity, Map<String, Object> metadata);

    boolean delete(String memoryId, Identity identity);

    long deleteAll(Identity identity);

    Map<String, Object> getStatistics(Identity identity);

    List<String> getUsers();
}

package com.memfacade.service;

import com.memfacade.memory.Identity;
import com.memfacade.memory.MemoryStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** Map-backed store with switches for the failure paths the service must absorb. */
class FakeMemoryStore implements MemoryStore {

    final Map<String, Map<String, Object>> records = new LinkedHashMap<>();
    final Map<String, Map<String, Object>> rawPayloads = new HashMap<>();
    final Set<String> failingGets = new HashSet<>();
    final Set<String> refusedDeletes = new HashSet<>();
    final List<Map<String, Object>> updateCalls = new ArrayList<>();

    Map<String, Object> nextAddResult;
    List<Object> listOverride;
    Map<String, Object> nativeStats = Map.of();
    RuntimeException addFailure;
    RuntimeException listFailure;
    RuntimeException rawPayloadFailure;
    private int nextId = 1;

    static Map<String, Object> map(Object... keyValues) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    void put(String id, Map<String, Object> payload) {
        var copy = new LinkedHashMap<>(payload);
        copy.put("id", id);
        records.put(id, copy);
    }

    @Override
    public Map<String, Object> add(String content, Identity identity, Map<String, Object> metadata,
                                   Map<String, Object> filters, String scope, String type, boolean infer) {
        if (addFailure != null) throw addFailure;
        if (nextAddResult != null) {
            var result = nextAddResult;
            nextAddResult = null;
            return result;
        }
        var id = "m" + nextId++;
        var payload = map("id", id, "memory", content, "user_id", identity.userId(),
                "agent_id", identity.agentId(), "metadata", metadata != null ? new LinkedHashMap<>(metadata) : map(),
                "type", type, "created_at", "2024-01-01T00:00:00Z", "updated_at", "2024-01-01T00:00:00Z");
        records.put(id, payload);
        return map("results", List.of(new LinkedHashMap<>(payload)));
    }

    @Override
    public Map<String, Object> get(String memoryId, Identity identity) {
        if (failingGets.contains(memoryId)) throw new RuntimeException("store unavailable");
        var record = records.get(memoryId);
        if (record == null || !visible(record, identity)) return null;
        return new LinkedHashMap<>(record);
    }

    @Override
    public Map<String, Object> getRawPayload(String memoryId) {
        if (rawPayloadFailure != null) throw rawPayloadFailure;
        return rawPayloads.get(memoryId);
    }

    @Override
    public Map<String, Object> getAll(Identity identity, int limit, int offset, String sortBy, String order) {
        if (listFailure != null) throw listFailure;
        if (listOverride != null) return map("results", listOverride);
        var visible = new ArrayList<Object>();
        for (var record : records.values()) {
            if (visible(record, identity)) visible.add(new LinkedHashMap<>(record));
        }
        int from = Math.min(offset, visible.size());
        int to = Math.min(from + limit, visible.size());
        return map("results", new ArrayList<>(visible.subList(from, to)));
    }

    @Override
    public Map<String, Object> update(String memoryId, String content, Identity identity,
                                      Map<String, Object> metadata) {
        updateCalls.add(map("id", memoryId, "content", content, "metadata", metadata));
        var record = records.get(memoryId);
        record.put("memory", content);
        record.put("metadata", metadata);
        // no id, like real update payloads
        return map("memory", content, "metadata", metadata);
    }

    @Override
    public boolean delete(String memoryId, Identity identity) {
        if (refusedDeletes.contains(memoryId)) return false;
        return records.remove(memoryId) != null;
    }

    @Override
    public long deleteAll(Identity identity) {
        var doomed = new ArrayList<String>();
        records.forEach((id, record) -> {
            if (visible(record, identity)) doomed.add(id);
        });
        doomed.forEach(records::remove);
        return doomed.size();
    }

    @Override
    public Map<String, Object> getStatistics(Identity identity) {
        return nativeStats;
    }

    @Override
    public List<String> getUsers() {
        var users = new LinkedHashSet<String>();
        for (var record : records.values()) {
            if (record.get("user_id") != null) users.add(record.get("user_id").toString());
        }
        return new ArrayList<>(users);
    }

    private static boolean visible(Map<String, Object> record, Identity identity) {
        return (identity.userId() == null || Objects.equals(identity.userId(), record.get("user_id")))
                && (identity.agentId() == null || Objects.equals(identity.agentId(), record.get("agent_id")));
    }
}

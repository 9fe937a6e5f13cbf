package com.memfacade.service;

import com.memfacade.memory.Identity;
import com.memfacade.memory.MemoryRecord;
import com.memfacade.memory.MemoryStore;
import com.memfacade.memory.MemoryUpdate;
import com.memfacade.memory.NewMemory;
import com.memfacade.memory.ResultNormalizer;
import com.memfacade.memory.SortField;
import com.memfacade.memory.SortOrder;
import com.memfacade.memory.Timestamps;
import com.memfacade.observability.MemoryMetrics;
import com.memfacade.shared.config.MemFacadeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point for memory operations. Orchestrates a {@link MemoryStore}: shapes its
 * responses through {@link ResultNormalizer}, merges updates over the existing record,
 * runs multi-item operations with per-item failure capture, and computes analytics over
 * bounded scans.
 *
 * <p>Updates are read-merge-write and not atomic. Two concurrent updates to the same
 * memory resolve last-write-wins.
 */
public class MemoryService {

    private static final Logger log = LoggerFactory.getLogger(MemoryService.class);

    private final MemoryStore store;
    private final MemoryMetrics metrics;
    private final BatchExecutor batchExecutor;
    private final StatisticsEngine statisticsEngine;
    private final QualityAnalyzer qualityAnalyzer;
    private final int scanLimit;
    private final int defaultListLimit;
    private final int maxMessageLength;

    public MemoryService(MemoryStore store) {
        this(store, MemFacadeConfig.defaults(), new MemoryMetrics());
    }

    public MemoryService(MemoryStore store, MemFacadeConfig config, MemoryMetrics metrics) {
        this(store, config, metrics, new StatisticsEngine(), new QualityAnalyzer());
    }

    public MemoryService(MemoryStore store, MemFacadeConfig config, MemoryMetrics metrics,
                         StatisticsEngine statisticsEngine, QualityAnalyzer qualityAnalyzer) {
        this.store = store;
        this.metrics = metrics;
        this.statisticsEngine = statisticsEngine;
        this.qualityAnalyzer = qualityAnalyzer;
        this.scanLimit = config.scanLimit();
        this.defaultListLimit = config.defaultListLimit();
        this.maxMessageLength = config.maxErrorMessageLength();
        this.batchExecutor = new BatchExecutor(config.batchWorkers(), config.maxErrorMessageLength());
        log.info("MemoryService initialized (scanLimit={}, batchWorkers={})", scanLimit, config.batchWorkers());
    }

    public List<MemoryRecord> createMemory(NewMemory memory, Identity identity, boolean infer) {
        var id = scoped(identity);
        return track("create", ErrorKind.CREATE_FAILED, "Failed to create memory", () -> {
            var result = store.add(memory.content(), id, memory.metadata(), memory.filters(),
                    memory.scope(), memory.type(), infer);
            var entries = ResultNormalizer.results(result);
            if (entries.isEmpty()) {
                log.info("No memories were created (likely duplicates detected or no facts extracted)");
                return List.<MemoryRecord>of();
            }
            log.info("Created {} memory/memories", entries.size());

            var created = new ArrayList<MemoryRecord>();
            for (var raw : entries) {
                var entry = asMap(raw);
                if (entry == null) continue;
                var memoryId = ResultNormalizer.resolveId(entry);
                if (memoryId == null) continue;
                created.add(refetchOrFallback(memoryId, entry, memory, id));
            }
            return created;
        });
    }

    private MemoryRecord refetchOrFallback(String memoryId, Map<String, Object> entry,
                                           NewMemory input, Identity identity) {
        try {
            return fetch(memoryId, identity);
        } catch (MemoryServiceException e) {
            log.warn("Failed to fetch full memory info for {}: {}, using result entry", memoryId, e.getMessage());
            return ResultNormalizer.fromCreateResult(entry, memoryId, input, identity);
        }
    }

    public MemoryRecord getMemory(String memoryId, Identity identity) {
        return track("get", ErrorKind.INTERNAL_ERROR, "Failed to get memory",
                () -> fetch(memoryId, scoped(identity)));
    }

    public List<MemoryRecord> listMemories(Identity identity) {
        return listMemories(identity, defaultListLimit, 0, SortField.NONE, SortOrder.DESC);
    }

    public List<MemoryRecord> listMemories(Identity identity, int limit, int offset,
                                           SortField sortBy, SortOrder order) {
        if (limit < 1) throw MemoryServiceException.invalid("limit must be positive: " + limit);
        if (offset < 0) throw MemoryServiceException.invalid("offset must not be negative: " + offset);
        var sort = sortBy != null ? sortBy : SortField.NONE;
        var direction = order != null ? order : SortOrder.DESC;
        return track("list", ErrorKind.INTERNAL_ERROR, "Failed to list memories",
                () -> readAll(scoped(identity), limit, offset, sort.key(), direction.key(), true));
    }

    public List<String> getUsers() {
        return track("users", ErrorKind.INTERNAL_ERROR, "Failed to get users", () -> {
            var users = store.getUsers();
            return users != null ? new ArrayList<>(users) : new ArrayList<String>();
        });
    }

    private MemoryRecord fetch(String memoryId, Identity identity) {
        if (memoryId == null) throw MemoryServiceException.invalid("memory_id is required");
        Map<String, Object> payload;
        try {
            payload = store.get(memoryId, identity);
        } catch (RuntimeException e) {
            log.error("Failed to get memory {}", memoryId, e);
            throw MemoryServiceException.wrap(ErrorKind.INTERNAL_ERROR, "Failed to get memory", e, maxMessageLength);
        }
        if (payload == null) throw MemoryServiceException.notFound(memoryId);

        var record = ResultNormalizer.normalize(payload, memoryId);
        if (record.content().isEmpty()) {
            record = reconcileContent(record);
        }
        return record;
    }

    // stores may persist content under data
    private MemoryRecord reconcileContent(MemoryRecord record) {
        try {
            var raw = store.getRawPayload(record.id());
            if (raw != null && raw.get("data") != null) {
                var data = raw.get("data").toString();
                if (!data.isEmpty()) return record.withContent(data);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to get content from storage payload for memory {}: {}", record.id(), e.getMessage());
        }
        return record;
    }

    private List<MemoryRecord> readAll(Identity identity, int limit, int offset, String sortBy, String order,
                                       boolean requireId) {
        var entries = ResultNormalizer.results(store.getAll(identity, limit, offset, sortBy, order));
        var records = new ArrayList<MemoryRecord>(entries.size());
        for (var raw : entries) {
            var entry = asMap(raw);
            if (entry == null) {
                log.warn("Skipping non-map item in memories list: {}", raw == null ? "null" : raw.getClass().getName());
                continue;
            }
            if (!requireId) {
                records.add(ResultNormalizer.normalizeForScan(entry));
                continue;
            }
            try {
                records.add(ResultNormalizer.normalize(entry));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed memory entry: {}", e.getMessage());
            }
        }
        return records;
    }

    public MemoryRecord updateMemory(String memoryId, String content, Map<String, Object> metadata,
                                     Identity identity) {
        return track("update", ErrorKind.UPDATE_FAILED, "Failed to update memory",
                () -> applyUpdate(memoryId, content, metadata, scoped(identity)));
    }

    private MemoryRecord applyUpdate(String memoryId, String content, Map<String, Object> metadata,
                                     Identity identity) {
        if (content == null && metadata == null) {
            throw MemoryServiceException.invalid("At least one of content or metadata must be provided");
        }
        var existing = fetch(memoryId, identity);
        var finalContent = content != null ? content : existing.content();
        var finalMetadata = mergeMetadata(existing.metadata(), metadata);

        Map<String, Object> result;
        try {
            result = store.update(memoryId, finalContent, identity, finalMetadata);
        } catch (RuntimeException e) {
            log.error("Failed to update memory {}", memoryId, e);
            throw MemoryServiceException.wrap(ErrorKind.UPDATE_FAILED, "Failed to update memory", e, maxMessageLength);
        }
        if (result == null) {
            throw new MemoryServiceException(ErrorKind.UPDATE_FAILED,
                    "Failed to update memory " + memoryId + ": store returned no payload");
        }

        // update payloads may omit the id and other unchanged fields
        var payload = new LinkedHashMap<>(result);
        payload.putIfAbsent("id", memoryId);
        payload.putIfAbsent("metadata", finalMetadata);
        if (ResultNormalizer.resolveContent(payload) == null) payload.put("content", finalContent);
        log.info("Memory updated: {}", memoryId);
        return ResultNormalizer.normalize(payload, memoryId);
    }

    static Map<String, Object> mergeMetadata(Map<String, Object> existing, Map<String, Object> incoming) {
        var hasExisting = existing != null && !existing.isEmpty();
        if (incoming != null && hasExisting) {
            var merged = new LinkedHashMap<>(existing);
            merged.putAll(incoming);
            return merged;
        }
        if (hasExisting) return new LinkedHashMap<>(existing);
        return incoming != null ? new LinkedHashMap<>(incoming) : new LinkedHashMap<>();
    }

    public void deleteMemory(String memoryId, Identity identity) {
        track("delete", ErrorKind.DELETE_FAILED, "Failed to delete memory", () -> {
            remove(memoryId, scoped(identity));
            return null;
        });
    }

    public long deleteAllMemories(Identity identity) {
        var id = scoped(identity);
        return track("delete_all", ErrorKind.INTERNAL_ERROR, "Failed to delete all memories", () -> {
            var count = store.deleteAll(id);
            log.info("Deleted {} memories matching {}", count, id);
            return count;
        });
    }

    private void remove(String memoryId, Identity identity) {
        fetch(memoryId, identity);
        boolean deleted;
        try {
            deleted = store.delete(memoryId, identity);
        } catch (RuntimeException e) {
            log.error("Failed to delete memory {}", memoryId, e);
            throw MemoryServiceException.wrap(ErrorKind.DELETE_FAILED, "Failed to delete memory", e, maxMessageLength);
        }
        if (!deleted) {
            throw new MemoryServiceException(ErrorKind.DELETE_FAILED, "Failed to delete memory " + memoryId);
        }
        log.info("Memory deleted: {}", memoryId);
    }

    public BatchResult<String> bulkDeleteMemories(List<String> memoryIds, Identity identity) {
        var id = scoped(identity);
        return track("bulk_delete", ErrorKind.INTERNAL_ERROR, "Failed to delete memories",
                () -> batchExecutor.execute("delete", memoryIds, memoryId -> memoryId, memoryId -> {
                    remove(memoryId, id);
                    return memoryId;
                }));
    }

    public BatchResult<CreatedMemory> batchCreateMemories(List<NewMemory> items, Identity identity, boolean infer) {
        return batchCreateMemories(items, NewMemory.EMPTY, identity, infer);
    }

    public BatchResult<CreatedMemory> batchCreateMemories(List<NewMemory> items, NewMemory defaults,
                                                          Identity identity, boolean infer) {
        var id = scoped(identity);
        return track("batch_create", ErrorKind.INTERNAL_ERROR, "Failed to create memories",
                () -> batchExecutor.execute("create", items, NewMemory::content,
                        item -> createOne(item, defaults, id, infer)));
    }

    private CreatedMemory createOne(NewMemory item, NewMemory defaults, Identity identity, boolean infer) {
        if (item == null || item.content() == null || item.content().isEmpty()) {
            throw MemoryServiceException.invalid("Memory content is required");
        }
        var effective = item.withDefaults(defaults);
        Map<String, Object> result;
        try {
            result = store.add(item.content(), identity, effective.metadata(), effective.filters(),
                    effective.scope(), effective.type(), infer);
        } catch (RuntimeException e) {
            throw MemoryServiceException.wrap(ErrorKind.CREATE_FAILED, "Failed to create memory", e, maxMessageLength);
        }
        var memoryId = ResultNormalizer.extractCreatedId(result);
        if (memoryId == null) {
            throw new MemoryServiceException(ErrorKind.CREATE_FAILED, "Failed to extract memory_id from result");
        }
        return new CreatedMemory(memoryId, item.content());
    }

    public BatchResult<MemoryRecord> batchUpdateMemories(List<MemoryUpdate> updates, Identity identity) {
        var id = scoped(identity);
        return track("batch_update", ErrorKind.INTERNAL_ERROR, "Failed to update memories",
                () -> batchExecutor.execute("update", updates, MemoryUpdate::memoryId, update -> {
                    if (update == null || update.memoryId() == null) {
                        throw MemoryServiceException.invalid("memory_id is required for each update");
                    }
                    return applyUpdate(update.memoryId(), update.content(), update.metadata(), id);
                }));
    }

    public StatisticsSnapshot getStatistics(Identity identity) {
        return getStatistics(identity, null);
    }

    /**
     * Without a cutoff the store's own aggregate is returned. With one, the store cannot
     * filter by date, so a bounded scan is filtered to {@code created_at >= cutoff} and
     * aggregated locally.
     */
    public StatisticsSnapshot getStatistics(Identity identity, Instant cutoff) {
        var id = scoped(identity);
        return track("statistics", ErrorKind.INTERNAL_ERROR, "Failed to get statistics", () -> {
            if (cutoff == null) {
                return statisticsEngine.fromNative(store.getStatistics(id));
            }
            return statisticsEngine.compute(scan(id, cutoff));
        });
    }

    public QualityReport analyzeQuality(Identity identity) {
        return analyzeQuality(identity, null);
    }

    public QualityReport analyzeQuality(Identity identity, Instant cutoff) {
        var id = scoped(identity);
        return track("quality", ErrorKind.INTERNAL_ERROR, "Failed to analyze memory quality", () -> {
            var report = qualityAnalyzer.analyze(scan(id, cutoff));
            log.info("Quality analysis complete: {}/{} low quality memories",
                    report.lowQualityCount(), report.totalMemories());
            return report;
        });
    }

    private List<MemoryRecord> scan(Identity identity, Instant cutoff) {
        return metrics.analyticsScan().record(() -> {
            var records = readAll(identity, scanLimit, 0, null, SortOrder.DESC.key(), false);
            if (records.size() >= scanLimit) {
                log.warn("Analytics scan hit the cap of {} records; results cover a partial set", scanLimit);
            }
            if (cutoff == null) return records;
            var kept = new ArrayList<MemoryRecord>();
            for (var r : records) {
                if (!Timestamps.parse(r.createdAt()).isBefore(cutoff)) kept.add(r);
            }
            return kept;
        });
    }

    private <T> T track(String operation, ErrorKind failureKind, String failureMessage, Supplier<T> action) {
        try {
            var result = action.get();
            metrics.recordOperation(operation, true);
            return result;
        } catch (MemoryServiceException e) {
            metrics.recordOperation(operation, false);
            throw e;
        } catch (RuntimeException e) {
            metrics.recordOperation(operation, false);
            log.error("{}", failureMessage, e);
            throw MemoryServiceException.wrap(failureKind, failureMessage, e, maxMessageLength);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object entry) {
        return entry instanceof Map ? (Map<String, Object>) entry : null;
    }

    private static Identity scoped(Identity identity) {
        return identity != null ? identity : Identity.none();
    }
}

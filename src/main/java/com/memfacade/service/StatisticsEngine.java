package com.memfacade.service;

import com.memfacade.memory.MemoryRecord;
import com.memfacade.memory.ResultNormalizer;
import com.memfacade.memory.Timestamps;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregates a record set into a {@link StatisticsSnapshot}. Records without a parseable
 * {@code created_at} still count toward totals, types and importance, but not toward
 * growth or age.
 */
public class StatisticsEngine {

    static final int TOP_ACCESSED_LIMIT = 10;
    static final int PREVIEW_LENGTH = 100;
    static final double DEFAULT_IMPORTANCE = 0.5;
    static final String UNKNOWN_TYPE = "unknown";

    private final Clock clock;

    public StatisticsEngine() {
        this(Clock.systemUTC());
    }

    public StatisticsEngine(Clock clock) {
        this.clock = clock;
    }

    public StatisticsSnapshot compute(List<MemoryRecord> records) {
        if (records.isEmpty()) return StatisticsSnapshot.empty();

        var now = clock.instant();
        var byType = new LinkedHashMap<String, Long>();
        var growth = new TreeMap<String, Long>();
        var ages = StatisticsSnapshot.emptyAgeDistribution();
        var accessed = new ArrayList<StatisticsSnapshot.AccessedMemory>();
        double importanceSum = 0;

        for (var r : records) {
            var type = r.type() == null || r.type().isBlank() ? UNKNOWN_TYPE : r.type();
            byType.merge(type, 1L, Long::sum);

            importanceSum += r.importance() != null ? r.importance() : DEFAULT_IMPORTANCE;

            if (r.accessCount() > 0) {
                accessed.add(new StatisticsSnapshot.AccessedMemory(r.id(), preview(r.content()), r.accessCount()));
            }

            var created = Timestamps.parse(r.createdAt());
            if (!Timestamps.isKnown(created)) continue;
            growth.merge(LocalDate.ofInstant(created, ZoneOffset.UTC).toString(), 1L, Long::sum);
            ages.merge(ageBucket(Duration.between(created, now).toDays()), 1L, Long::sum);
        }

        // List.sort is stable, so ties keep scan order
        accessed.sort(Comparator.comparingInt(StatisticsSnapshot.AccessedMemory::accessCount).reversed());
        var top = accessed.size() > TOP_ACCESSED_LIMIT ? accessed.subList(0, TOP_ACCESSED_LIMIT) : accessed;

        return new StatisticsSnapshot(records.size(), byType, importanceSum / records.size(),
                top, growth, ages);
    }

    @SuppressWarnings("unchecked")
    public StatisticsSnapshot fromNative(Map<String, Object> stats) {
        if (stats == null || stats.isEmpty()) return StatisticsSnapshot.empty();

        var top = new ArrayList<StatisticsSnapshot.AccessedMemory>();
        if (stats.get("top_accessed") instanceof List) {
            for (var item : (List<Object>) stats.get("top_accessed")) {
                if (!(item instanceof Map)) continue;
                var entry = (Map<String, Object>) item;
                var content = ResultNormalizer.resolveContent(entry);
                top.add(new StatisticsSnapshot.AccessedMemory(
                        ResultNormalizer.resolveId(entry),
                        preview(content),
                        toLong(entry.get("access_count")).intValue()));
            }
        }

        Map<String, Long> ages = counts(stats.get("age_distribution"));
        if (ages.isEmpty()) ages = StatisticsSnapshot.emptyAgeDistribution();

        var avg = stats.get("avg_importance");
        return new StatisticsSnapshot(
                toLong(stats.get("total_memories")),
                counts(stats.get("by_type")),
                avg instanceof Number ? ((Number) avg).doubleValue() : 0.0,
                top,
                counts(stats.get("growth_trend")),
                ages);
    }

    static String ageBucket(long days) {
        if (days < 1) return StatisticsSnapshot.AGE_UNDER_1_DAY;
        if (days < 7) return StatisticsSnapshot.AGE_1_TO_7_DAYS;
        if (days < 30) return StatisticsSnapshot.AGE_7_TO_30_DAYS;
        return StatisticsSnapshot.AGE_OVER_30_DAYS;
    }

    private static String preview(String content) {
        if (content == null) return "";
        return content.length() > PREVIEW_LENGTH ? content.substring(0, PREVIEW_LENGTH) : content;
    }

    private static Map<String, Long> counts(Object value) {
        var result = new LinkedHashMap<String, Long>();
        if (value instanceof Map) {
            ((Map<?, ?>) value).forEach((k, v) -> result.put(String.valueOf(k), toLong(v)));
        }
        return result;
    }

    private static Long toLong(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }
}

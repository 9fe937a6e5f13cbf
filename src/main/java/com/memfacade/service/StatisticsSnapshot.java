package com.memfacade.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record StatisticsSnapshot(
    long totalMemories,
    Map<String, Long> byType,
    double avgImportance,
    List<AccessedMemory> topAccessed,
    Map<String, Long> growthTrend,
    Map<String, Long> ageDistribution
) {
    public static final String AGE_UNDER_1_DAY = "<1 day";
    public static final String AGE_1_TO_7_DAYS = "1-7 days";
    public static final String AGE_7_TO_30_DAYS = "7-30 days";
    public static final String AGE_OVER_30_DAYS = ">30 days";
    public static final List<String> AGE_BUCKETS =
            List.of(AGE_UNDER_1_DAY, AGE_1_TO_7_DAYS, AGE_7_TO_30_DAYS, AGE_OVER_30_DAYS);

    public StatisticsSnapshot {
        byType = ordered(byType);
        topAccessed = List.copyOf(topAccessed);
        growthTrend = ordered(growthTrend);
        ageDistribution = ordered(ageDistribution);
    }

    public record AccessedMemory(String id, String contentPreview, int accessCount) {}

    public static StatisticsSnapshot empty() {
        return new StatisticsSnapshot(0, Map.of(), 0.0, List.of(), Map.of(), emptyAgeDistribution());
    }

    public static Map<String, Long> emptyAgeDistribution() {
        var buckets = new LinkedHashMap<String, Long>();
        for (var bucket : AGE_BUCKETS) buckets.put(bucket, 0L);
        return buckets;
    }

    public Map<String, Object> toMap() {
        var top = new ArrayList<Map<String, Object>>();
        for (var m : topAccessed) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("id", m.id());
            entry.put("content", m.contentPreview());
            entry.put("access_count", m.accessCount());
            top.add(entry);
        }
        var map = new LinkedHashMap<String, Object>();
        map.put("total_memories", totalMemories);
        map.put("by_type", byType);
        map.put("avg_importance", avgImportance);
        map.put("top_accessed", top);
        map.put("growth_trend", growthTrend);
        map.put("age_distribution", ageDistribution);
        return map;
    }

    private static Map<String, Long> ordered(Map<String, Long> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}

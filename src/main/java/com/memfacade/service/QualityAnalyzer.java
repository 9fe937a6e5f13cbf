package com.memfacade.service;

import com.memfacade.memory.MemoryRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Flags records that look defective. Criteria are independent: each one counts every
 * record it fires on, while a record counts once toward {@code low_quality_count}.
 */
public class QualityAnalyzer {

    public static final String MISSING_METADATA = "missing_metadata";
    public static final String EMPTY_CONTENT = "empty_content";
    public static final String LOW_IMPORTANCE = "low_importance";

    static final int MIN_CONTENT_LENGTH = 5;
    static final double LOW_IMPORTANCE_THRESHOLD = 0.3;

    public QualityReport analyze(List<MemoryRecord> records) {
        if (records.isEmpty()) return QualityReport.empty();

        var criteria = new LinkedHashMap<String, Long>();
        criteria.put(MISSING_METADATA, 0L);
        criteria.put(EMPTY_CONTENT, 0L);
        criteria.put(LOW_IMPORTANCE, 0L);
        // records without an id are keyed by their scan position
        var flagged = new HashSet<Object>();

        for (int i = 0; i < records.size(); i++) {
            var r = records.get(i);
            Object key = r.id() != null ? r.id() : Integer.valueOf(i);
            if (r.metadata().isEmpty()) {
                criteria.merge(MISSING_METADATA, 1L, Long::sum);
                flagged.add(key);
            }
            if (r.content().strip().length() < MIN_CONTENT_LENGTH) {
                criteria.merge(EMPTY_CONTENT, 1L, Long::sum);
                flagged.add(key);
            }
            if (r.importance() != null && r.importance() < LOW_IMPORTANCE_THRESHOLD) {
                criteria.merge(LOW_IMPORTANCE, 1L, Long::sum);
                flagged.add(key);
            }
        }

        double ratio = BigDecimal.valueOf((double) flagged.size() / records.size())
                .setScale(4, RoundingMode.HALF_UP)
                .doubleValue();
        return new QualityReport(records.size(), flagged.size(), ratio, criteria);
    }
}

package com.memfacade.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record QualityReport(
    long totalMemories,
    long lowQualityCount,
    double lowQualityRatio,
    Map<String, Long> qualityCriteria
) {
    public QualityReport {
        qualityCriteria = Collections.unmodifiableMap(new LinkedHashMap<>(qualityCriteria));
    }

    public static QualityReport empty() {
        return new QualityReport(0, 0, 0.0, Map.of());
    }
}

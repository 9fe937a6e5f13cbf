package com.memfacade.shared.config;

import java.nio.file.Path;

public record MemFacadeConfig(
    String indexPath,
    int scanLimit,
    int defaultListLimit,
    int batchWorkers,
    int maxErrorMessageLength
) {
    public static final int DEFAULT_SCAN_LIMIT = 10_000;

    public static String defaultIndexPath() {
        return Path.of(System.getProperty("user.home"), ".memfacade", "index").toString();
    }

    public static MemFacadeConfig defaults() {
        return new MemFacadeConfig(defaultIndexPath(), DEFAULT_SCAN_LIMIT, 100, 1, 200);
    }
}

package com.memfacade.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".memfacade", "config.yaml"
    );

    public static MemFacadeConfig load() {
        return load(DEFAULT_PATH, System.getenv());
    }

    public static MemFacadeConfig load(Path path) {
        return load(path, System.getenv());
    }

    static MemFacadeConfig load(Path path, Map<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var defaults = MemFacadeConfig.defaults();
        var store = section(raw, "store");
        var analytics = section(raw, "analytics");
        var list = section(raw, "list");
        var batch = section(raw, "batch");
        var errors = section(raw, "errors");

        return new MemFacadeConfig(
            env.getOrDefault("MEMFACADE_INDEX_PATH",
                String.valueOf(store.getOrDefault("index-path", defaults.indexPath()))),
            positive(analytics.getOrDefault("scan-limit", defaults.scanLimit()), "analytics.scan-limit"),
            positive(list.getOrDefault("default-limit", defaults.defaultListLimit()), "list.default-limit"),
            positive(env.getOrDefault("MEMFACADE_BATCH_WORKERS",
                String.valueOf(batch.getOrDefault("workers", defaults.batchWorkers()))), "batch.workers"),
            positive(errors.getOrDefault("max-message-length", defaults.maxErrorMessageLength()),
                "errors.max-message-length")
        );
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> raw, String key) {
        var value = raw.get(key);
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    private static int positive(Object value, String key) {
        int parsed;
        try {
            parsed = Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config " + key + " must be an integer: " + value, e);
        }
        if (parsed < 1) {
            throw new IllegalArgumentException("Config " + key + " must be positive: " + parsed);
        }
        return parsed;
    }
}

package com.memfacade.memory;

import java.util.Map;

public record NewMemory(
    String content,
    Map<String, Object> metadata,
    Map<String, Object> filters,
    String scope,
    String type
) {
    public static final NewMemory EMPTY = new NewMemory(null, null, null, null, null);

    public static NewMemory of(String content) {
        return new NewMemory(content, null, null, null, null);
    }

    public NewMemory withMetadata(Map<String, Object> metadata) {
        return new NewMemory(content, metadata, filters, scope, type);
    }

    public NewMemory withType(String type) {
        return new NewMemory(content, metadata, filters, scope, type);
    }

    public NewMemory withDefaults(NewMemory defaults) {
        if (defaults == null) return this;
        return new NewMemory(
            content != null ? content : defaults.content(),
            metadata != null ? metadata : defaults.metadata(),
            filters != null ? filters : defaults.filters(),
            scope != null ? scope : defaults.scope(),
            type != null ? type : defaults.type()
        );
    }
}

package com.memfacade.memory;

public enum SortField {
    CREATED_AT("created_at"),
    UPDATED_AT("updated_at"),
    ID("id"),
    NONE(null);

    private final String key;

    SortField(String key) {
        this.key = key;
    }

    public String key() { return key; }
}

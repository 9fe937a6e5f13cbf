package com.memfacade.memory;

import java.util.Locale;

public enum SortOrder {
    ASC, DESC;

    public String key() { return name().toLowerCase(Locale.ROOT); }
}

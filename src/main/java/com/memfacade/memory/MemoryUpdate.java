package com.memfacade.memory;

import java.util.Map;

public record MemoryUpdate(String memoryId, String content, Map<String, Object> metadata) {}

package com.memfacade.service;

public record CreatedMemory(String memoryId, String content) {}

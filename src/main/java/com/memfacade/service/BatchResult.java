package com.memfacade.service;

import java.util.List;

/**
 * Outcome of a multi-item operation. Every index in {@code [0, total)} appears in exactly
 * one of {@link #successes()} or {@link #failures()}, both ordered by index.
 */
public record BatchResult<T>(List<Success<T>> successes, List<Failure> failures, int total) {

    public BatchResult {
        successes = List.copyOf(successes);
        failures = List.copyOf(failures);
    }

    public int successCount() { return successes.size(); }

    public int failureCount() { return failures.size(); }

    public static <T> BatchResult<T> empty() {
        return new BatchResult<>(List.of(), List.of(), 0);
    }

    public record Success<T>(int index, T value) {}

    public record Failure(int index, String reference, ErrorKind kind, String error) {}
}

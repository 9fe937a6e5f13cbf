package com.memfacade.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Runs a single-item operation over every input independently. One item's failure never
 * stops the others; results are collected by original index whatever the completion order.
 */
public class BatchExecutor {

    private static final Logger log = LoggerFactory.getLogger(BatchExecutor.class);

    @FunctionalInterface
    public interface ItemOperation<I, O> {
        O apply(I item);
    }

    private final int workers;
    private final int maxMessageLength;

    public BatchExecutor() {
        this(1, MemoryServiceException.DEFAULT_MAX_MESSAGE_LENGTH);
    }

    // workers == 1 runs on the caller's thread
    public BatchExecutor(int workers, int maxMessageLength) {
        this.workers = Math.max(1, workers);
        this.maxMessageLength = maxMessageLength;
    }

    public <I, O> BatchResult<O> execute(String operation, List<I> items,
                                         Function<I, String> reference, ItemOperation<I, O> op) {
        if (items == null) {
            throw MemoryServiceException.invalid("Batch " + operation + " requires a list of items");
        }
        if (items.isEmpty()) return BatchResult.empty();

        var outcomes = workers > 1 && items.size() > 1
                ? runParallel(operation, items, reference, op)
                : runSequential(operation, items, reference, op);

        var successes = new ArrayList<BatchResult.Success<O>>();
        var failures = new ArrayList<BatchResult.Failure>();
        for (var outcome : outcomes) {
            if (outcome.failure() != null) {
                failures.add(outcome.failure());
            } else {
                successes.add(outcome.success());
            }
        }
        log.info("Batch {} finished: {} succeeded, {} failed of {}",
                operation, successes.size(), failures.size(), items.size());
        return new BatchResult<>(successes, failures, items.size());
    }

    private <I, O> List<Outcome<O>> runSequential(String operation, List<I> items,
                                                  Function<I, String> reference, ItemOperation<I, O> op) {
        var outcomes = new ArrayList<Outcome<O>>(items.size());
        for (int i = 0; i < items.size(); i++) {
            outcomes.add(runOne(operation, i, items.get(i), reference, op));
        }
        return outcomes;
    }

    private <I, O> List<Outcome<O>> runParallel(String operation, List<I> items,
                                                Function<I, String> reference, ItemOperation<I, O> op) {
        var pool = Executors.newFixedThreadPool(Math.min(workers, items.size()));
        try {
            var futures = new ArrayList<Future<Outcome<O>>>(items.size());
            for (int i = 0; i < items.size(); i++) {
                final int index = i;
                final I item = items.get(i);
                futures.add(pool.submit(() -> runOne(operation, index, item, reference, op)));
            }
            var outcomes = new ArrayList<Outcome<O>>(items.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    outcomes.add(failed(i, items.get(i), reference, ErrorKind.INTERNAL_ERROR,
                            MemoryServiceException.describe(e.getCause())));
                }
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MemoryServiceException(ErrorKind.INTERNAL_ERROR,
                    "Interrupted while running batch " + operation, e);
        } finally {
            pool.shutdownNow();
        }
    }

    private <I, O> Outcome<O> runOne(String operation, int index, I item,
                                     Function<I, String> reference, ItemOperation<I, O> op) {
        try {
            return new Outcome<>(new BatchResult.Success<>(index, op.apply(item)), null);
        } catch (MemoryServiceException e) {
            log.warn("Failed to {} item at index {}: [{}] {}", operation, index, e.kind(), e.getMessage());
            return failed(index, item, reference, e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to {} item at index {}", operation, index, e);
            return failed(index, item, reference, ErrorKind.INTERNAL_ERROR, MemoryServiceException.describe(e));
        }
    }

    private <I, O> Outcome<O> failed(int index, I item, Function<I, String> reference,
                                     ErrorKind kind, String message) {
        String ref = null;
        if (item != null) {
            try {
                ref = reference.apply(item);
            } catch (RuntimeException e) {
                log.debug("Could not describe batch item {}", index, e);
            }
        }
        return new Outcome<>(null, new BatchResult.Failure(index, ref, kind,
                MemoryServiceException.truncate(message, maxMessageLength)));
    }

    private record Outcome<O>(BatchResult.Success<O> success, BatchResult.Failure failure) {}
}

package com.nilsson.photostamper.service;

import com.nilsson.photostamper.model.BatchSummary;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 Handle on a batch running in the background.
 * <p>{@link #cancel()} is cooperative: the worker checks it between files, so the file
 being processed is always finished (or skipped) before the batch stops.</p>
 */
public class BatchJob {

    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final CompletableFuture<BatchSummary> result = new CompletableFuture<>();

    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public boolean isDone() {
        return result.isDone();
    }

    public CompletableFuture<BatchSummary> getResult() {
        return result;
    }

    public BatchSummary await() throws InterruptedException, ExecutionException {
        return result.get();
    }

    public BatchSummary await(long timeout, TimeUnit unit) throws InterruptedException, ExecutionException, TimeoutException {
        return result.get(timeout, unit);
    }

    void complete(BatchSummary summary) {
        result.complete(summary);
    }

    void fail(Throwable error) {
        result.completeExceptionally(error);
    }
}

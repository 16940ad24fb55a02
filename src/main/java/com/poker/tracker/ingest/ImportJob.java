package com.poker.tracker.ingest;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on a running import: progress, cancellation and the final report.
 */
@Getter
public class ImportJob {

    private final String id = UUID.randomUUID().toString();
    private final ImportProgress progress = new ImportProgress();
    private final CompletableFuture<BatchReport> result = new CompletableFuture<>();

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Requests an early stop. Hands already accepted stay accepted.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

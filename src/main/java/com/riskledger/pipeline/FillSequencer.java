package com.riskledger.pipeline;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs fill work serially per session and concurrently across sessions.
 *
 * <p>Each submission is chained onto the previous one for the same session, so fills of
 * one session are applied in submission order even though they run on a shared pool.
 * A failed task does not break the chain for later fills.
 */
@Component
public class FillSequencer {

    private final Executor executor;
    private final ConcurrentHashMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public FillSequencer(@Qualifier("fillExecutor") Executor executor) {
        this.executor = executor;
    }

    public CompletableFuture<Void> submit(String sessionId, Runnable task) {
        CompletableFuture<Void> next = tails.compute(sessionId, (key, tail) -> {
            CompletableFuture<Void> previous = tail == null
                    ? CompletableFuture.completedFuture(null)
                    : tail.exceptionally(e -> null);
            return previous.thenRunAsync(task, executor);
        });
        next.whenComplete((result, error) -> tails.remove(sessionId, next));
        return next;
    }

    /** Sessions with fill work queued or running. */
    public int activeSessions() {
        return tails.size();
    }
}

package com.catdb.execution;

import java.util.concurrent.CompletableFuture;

/**
 * One-shot cancel signal shared between a caller and a running execution.
 */
public final class CancelToken {

    private final CompletableFuture<Void> signal = new CompletableFuture<>();

    /**
     * Signal cancellation. Later calls have no effect.
     */
    public void cancel() {
        signal.complete(null);
    }

    public boolean isCancelled() {
        return signal.isDone();
    }

    /**
     * Future that completes when the token is signaled. Completing the returned future does not
     * signal the token.
     *
     * @return future
     */
    public CompletableFuture<Void> whenCancelled() {
        return signal.copy();
    }
}

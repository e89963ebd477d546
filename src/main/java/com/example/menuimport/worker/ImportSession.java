package com.example.menuimport.worker;

/**
 * Per-run worker state: the cancellation flag and the id pool. A new session is created for
 * every run and only that run's worker thread reads it, apart from {@link #cancel()}.
 */
public final class ImportSession {

    private final IdentifierPool identifiers;
    private volatile boolean cancelled;

    public ImportSession(IdentifierPool identifiers) {
        this.identifiers = identifiers;
    }

    public IdentifierPool identifiers() {
        return identifiers;
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Inter-chunk suspension point. Gives up the processor, then reports whether the run should
     * stop, either because cancellation was requested or because the worker is being torn down.
     */
    boolean yieldAndCheckCancelled() {
        Thread.yield();
        return cancelled || Thread.currentThread().isInterrupted();
    }
}

package com.example.workflowengine.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stops a run from dispatching further components. Calls already in flight finish normally.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * A fresh token nobody else holds, so it is never cancelled.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

package com.example.protocolrebuild.regeneration;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-side abort for a reconstruction run. Once cancelled, no further oracle call is made.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

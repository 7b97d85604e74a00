package com.libragraph.salvage.core.progress;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal. Scanners poll it at candidate and record boundaries.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * A token that is cancelled when either it or {@code parent} is.
     */
    public static CancellationToken linkedTo(CancellationToken parent) {
        return new CancellationToken() {
            @Override
            public boolean isCancelled() {
                return super.isCancelled() || parent.isCancelled();
            }
        };
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

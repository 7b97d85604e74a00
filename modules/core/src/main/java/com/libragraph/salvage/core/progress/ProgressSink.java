package com.libragraph.salvage.core.progress;

/**
 * Caller-supplied progress receiver. Calls are fire-and-forget from scanning threads;
 * implementations must return quickly and must not assume any particular thread.
 */
@FunctionalInterface
public interface ProgressSink {

    ProgressSink NONE = event -> { };

    void report(ProgressEvent event);
}

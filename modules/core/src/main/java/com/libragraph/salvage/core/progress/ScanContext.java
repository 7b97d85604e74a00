package com.libragraph.salvage.core.progress;

import com.libragraph.salvage.core.diagnostic.Diagnostics;
import org.jboss.logging.Logger;

/**
 * What a scanner needs besides its input: where to report, when to stop, where to log anomalies.
 */
public record ScanContext(ProgressSink progress, CancellationToken cancellation, Diagnostics diagnostics) {

    private static final Logger log = Logger.getLogger(ScanContext.class);

    /**
     * Context with no progress receiver and a token nobody cancels.
     */
    public static ScanContext detached(String component) {
        return new ScanContext(ProgressSink.NONE, CancellationToken.none(), new Diagnostics(component, false));
    }

    public boolean cancelled() {
        return cancellation.isCancelled();
    }

    /**
     * Delivers an event. A failing sink is logged and otherwise ignored so it cannot abort a scan.
     */
    public void report(ProgressEvent event) {
        try {
            progress.report(event);
        } catch (RuntimeException e) {
            log.warnf(e, "Progress sink failed on %s", event.currentItemLabel());
        }
    }
}

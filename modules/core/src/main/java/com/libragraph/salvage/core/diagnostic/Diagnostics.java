package com.libragraph.salvage.core.diagnostic;

import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Thread-safe diagnostics collector for one component.
 *
 * <p>Counters are exact. Entries are retained up to {@code maxEntries}; beyond that only
 * the counters grow and {@link DiagnosticReport#droppedEntries()} says how many were not kept.
 */
public class Diagnostics {

    private static final Logger log = Logger.getLogger(Diagnostics.class);

    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    private final String component;
    private final boolean verbose;
    private final int maxEntries;
    private final List<Diagnostic> entries = new ArrayList<>();
    private final Map<DiagnosticKind, Long> counts = new EnumMap<>(DiagnosticKind.class);
    private long dropped;

    public Diagnostics(String component, boolean verbose) {
        this(component, verbose, DEFAULT_MAX_ENTRIES);
    }

    public Diagnostics(String component, boolean verbose, int maxEntries) {
        this.component = component;
        this.verbose = verbose;
        this.maxEntries = maxEntries;
    }

    public String component() {
        return component;
    }

    public void record(DiagnosticKind kind, long offset, String message) {
        Diagnostic diagnostic = new Diagnostic(component, kind, offset, message);
        if (verbose) {
            log.info(diagnostic);
        } else {
            log.tracef("%s", diagnostic);
        }
        synchronized (this) {
            counts.merge(kind, 1L, Long::sum);
            if (entries.size() < maxEntries) {
                entries.add(diagnostic);
            } else {
                dropped++;
            }
        }
    }

    public synchronized long count(DiagnosticKind kind) {
        return counts.getOrDefault(kind, 0L);
    }

    public synchronized DiagnosticReport snapshot(List<Tally> tallies) {
        return new DiagnosticReport(List.copyOf(entries), Map.copyOf(counts), List.copyOf(tallies), dropped);
    }

    public DiagnosticReport snapshot(Tally tally) {
        return snapshot(List.of(tally));
    }

    /**
     * Combines reports in the given order, so a fixed component order yields a fixed entry order.
     */
    public static DiagnosticReport combine(List<DiagnosticReport> reports) {
        List<Diagnostic> entries = new ArrayList<>();
        Map<DiagnosticKind, Long> counts = new EnumMap<>(DiagnosticKind.class);
        List<Tally> tallies = new ArrayList<>();
        long dropped = 0;
        for (DiagnosticReport report : reports) {
            entries.addAll(report.entries());
            report.counts().forEach((k, v) -> counts.merge(k, v, Long::sum));
            tallies.addAll(report.tallies());
            dropped += report.droppedEntries();
        }
        return new DiagnosticReport(List.copyOf(entries), Map.copyOf(counts), List.copyOf(tallies), dropped);
    }
}

package com.libragraph.salvage.core.diagnostic;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable diagnostics attached to a result.
 */
public record DiagnosticReport(
        List<Diagnostic> entries,
        Map<DiagnosticKind, Long> counts,
        List<Tally> tallies,
        long droppedEntries
) {
    public static DiagnosticReport empty() {
        return new DiagnosticReport(List.of(), Map.of(), List.of(), 0);
    }

    public long count(DiagnosticKind kind) {
        return counts.getOrDefault(kind, 0L);
    }

    public Optional<Tally> tally(String component) {
        return tallies.stream().filter(t -> t.component().equals(component)).findFirst();
    }

    public boolean reconciles() {
        return tallies.stream().allMatch(Tally::reconciles);
    }
}

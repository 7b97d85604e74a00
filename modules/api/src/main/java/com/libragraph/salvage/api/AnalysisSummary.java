package com.libragraph.salvage.api;

import java.util.Map;

/**
 * Counts-only view of one analysis and reconstruction pass.
 */
public record AnalysisSummary(
        String path,
        long bufferSize,
        boolean complete,
        Map<String, Long> carvedFiles,
        long records,
        long duplicateRecords,
        long groups,
        Map<String, Long> recordsByTag,
        long namedRecords,
        Map<String, Long> strings,
        long stringsLinkedToFiles,
        Coverage coverage,
        Map<String, Long> diagnostics,
        long droppedDiagnostics
) {
    public record Coverage(long claimedBytes, double claimedPercent, long gapCount, long gapBytes,
                           Map<String, Long> bytesByKind) {
    }
}

package com.libragraph.salvage.core.coverage;

import com.libragraph.salvage.types.CoverageKind;

import java.util.List;
import java.util.Map;

/**
 * Byte accounting over a reconciled coverage map.
 *
 * @param bytesByKind  bytes each kind keeps after reconciliation
 * @param largestGaps  biggest unclaimed ranges, largest first
 */
public record CoverageSummary(
        long totalBytes,
        long claimedBytes,
        Map<CoverageKind, Long> bytesByKind,
        long gapCount,
        long gapBytes,
        List<ByteRange> largestGaps
) {
    public double claimedPercent() {
        return totalBytes == 0 ? 0.0 : claimedBytes * 100.0 / totalBytes;
    }
}

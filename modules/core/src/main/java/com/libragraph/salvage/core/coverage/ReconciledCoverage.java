package com.libragraph.salvage.core.coverage;

import java.util.List;

/**
 * Terminal coverage map: claims ordered by offset, pairwise disjoint.
 */
public record ReconciledCoverage(List<Claim> claims, CoverageSummary summary, long trimmedOverlaps) {
}

package com.libragraph.salvage.core.esm;

import com.libragraph.salvage.core.diagnostic.DiagnosticReport;

import java.util.List;

/**
 * @param records    accepted records in offset order, one per FormID
 * @param duplicates valid records whose FormID was already taken by an earlier record
 * @param complete   false when the scan stopped on cancellation
 */
public record EsmScanResult(
        List<RawRecord> records,
        List<RawRecord> duplicates,
        List<GroupHeader> groups,
        DiagnosticReport diagnostics,
        boolean complete
) {
}
